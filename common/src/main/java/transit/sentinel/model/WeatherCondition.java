package transit.sentinel.model;

/**
 * Simplified weather classes derived from WMO weather codes.
 */
public enum WeatherCondition {
    CLEAR,
    PARTLY_CLOUDY,
    OVERCAST,
    FOG,
    RAIN,
    HEAVY_RAIN,
    SNOW,
    THUNDERSTORM,
    UNKNOWN;

    public static WeatherCondition fromWmoCode(int code) {
        if (code == 0) return CLEAR;
        if (code == 1 || code == 2) return PARTLY_CLOUDY;
        if (code == 3) return OVERCAST;
        if (code == 45 || code == 48) return FOG;
        if (code >= 51 && code <= 67) return RAIN;
        if (code >= 71 && code <= 77) return SNOW;
        if (code >= 80 && code <= 82) return HEAVY_RAIN;
        if (code >= 95 && code <= 99) return THUNDERSTORM;
        return UNKNOWN;
    }

    public boolean isSevere() {
        return this == HEAVY_RAIN || this == SNOW || this == THUNDERSTORM;
    }
}
