package transit.sentinel.quality;

import transit.sentinel.model.WeatherObservation;

import java.util.List;

public final class WeatherObservationRules {

    private WeatherObservationRules() {}

    public static List<QualityRule<WeatherObservation>> build(QualityConfig cfg) {
        return List.of(
                QualityRule.of("required-fields", (rule, w, now) -> {
                    if (Checks.blank(w.agencyId())) return Checks.missing(rule, "agency_id");
                    if (w.observationTime() == null) return Checks.missing(rule, "observation_time");
                    if (w.weatherCondition() == null) return Checks.missing(rule, "weather_condition");
                    return null;
                }),
                QualityRule.of("coordinate-range", (rule, w, now) -> {
                    if (!(w.latitude() >= -90.0 && w.latitude() <= 90.0)) {
                        return Checks.outOfRange(rule, "latitude", w.latitude(), "[-90, 90]");
                    }
                    if (!(w.longitude() >= -180.0 && w.longitude() <= 180.0)) {
                        return Checks.outOfRange(rule, "longitude", w.longitude(), "[-180, 180]");
                    }
                    return null;
                }),
                QualityRule.of("measurement-range", (rule, w, now) -> {
                    if (!(w.temperatureCelsius() >= -50.0 && w.temperatureCelsius() <= 60.0)) {
                        return Checks.outOfRange(rule, "temperature_celsius", w.temperatureCelsius(), "[-50, 60]");
                    }
                    if (!(w.precipitationMm() >= 0.0)) {
                        return Checks.outOfRange(rule, "precipitation_mm", w.precipitationMm(), "[0, +inf)");
                    }
                    if (!(w.windSpeedKmh() >= 0.0 && w.windSpeedKmh() <= 200.0)) {
                        return Checks.outOfRange(rule, "wind_speed_kmh", w.windSpeedKmh(), "[0, 200]");
                    }
                    if (w.weatherCode() < 0 || w.weatherCode() > 99) {
                        return Checks.outOfRange(rule, "weather_code", w.weatherCode(), "[0, 99]");
                    }
                    return null;
                }),
                QualityRule.of("observation-freshness", (rule, w, now) ->
                        Checks.freshness(rule, "observation_time", w.observationTime(), now, cfg.maxWeatherAge()))
        );
    }
}
