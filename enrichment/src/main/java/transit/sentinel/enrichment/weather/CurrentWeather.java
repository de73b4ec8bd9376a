package transit.sentinel.enrichment.weather;

import transit.sentinel.model.WeatherCondition;
import transit.sentinel.model.WeatherObservation;

import java.time.Instant;

/**
 * Current conditions as reported by the weather API, before they are tied to an agency.
 */
public record CurrentWeather(
        double temperatureCelsius,
        double windSpeedKmh,
        double precipitationMm,
        int weatherCode,
        Instant observedAt
) {
    public WeatherCondition condition() {
        return WeatherCondition.fromWmoCode(weatherCode);
    }

    public WeatherObservation toObservation(double latitude, double longitude, String agencyId) {
        return new WeatherObservation(latitude, longitude, temperatureCelsius, precipitationMm, windSpeedKmh,
                weatherCode, condition(), observedAt, agencyId);
    }
}
