package transit.sentinel.enrichment.weather;

import transit.sentinel.model.WeatherCondition;

import java.time.Instant;

/**
 * One forecast hour. Any measurement may be missing from the response.
 */
public record HourlyForecast(
        Instant time,
        Double temperatureCelsius,
        Double precipitationMm,
        Double windSpeedKmh,
        Integer weatherCode
) {
    public WeatherCondition condition() {
        return weatherCode == null ? WeatherCondition.UNKNOWN : WeatherCondition.fromWmoCode(weatherCode);
    }
}
