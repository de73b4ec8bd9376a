package transit.sentinel.model;

import java.time.Instant;

public record WeatherObservation(
        double latitude,
        double longitude,
        double temperatureCelsius,
        double precipitationMm,
        double windSpeedKmh,
        int weatherCode,
        WeatherCondition weatherCondition,
        Instant observationTime,
        String agencyId
) {
    public String entityId() {
        return String.format(java.util.Locale.ROOT, "%.2f,%.2f", latitude, longitude);
    }
}
