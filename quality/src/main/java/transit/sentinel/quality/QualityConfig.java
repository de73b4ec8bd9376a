package transit.sentinel.quality;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Thresholds for the quality gate.
 *
 * @param agencyBounds per-agency service area; agencies not listed fall back to {@code defaultBounds}
 */
public record QualityConfig(
        double maxSpeedMps,
        Duration maxPositionAge,
        Duration maxWeatherAge,
        int minDelaySeconds,
        int maxDelaySeconds,
        GeoBounds defaultBounds,
        Map<String, GeoBounds> agencyBounds
) {
    public QualityConfig {
        if (maxSpeedMps <= 0) throw new IllegalArgumentException("maxSpeedMps must be > 0");
        Objects.requireNonNull(maxPositionAge, "maxPositionAge");
        Objects.requireNonNull(maxWeatherAge, "maxWeatherAge");
        if (maxPositionAge.isNegative()) throw new IllegalArgumentException("maxPositionAge must be >= 0");
        if (maxWeatherAge.isNegative()) throw new IllegalArgumentException("maxWeatherAge must be >= 0");
        if (minDelaySeconds > maxDelaySeconds) throw new IllegalArgumentException("minDelaySeconds must be <= maxDelaySeconds");
        defaultBounds = defaultBounds == null ? GeoBounds.WORLD : defaultBounds;
        agencyBounds = agencyBounds == null ? Map.of() : Map.copyOf(agencyBounds);
    }

    public static QualityConfig defaults() {
        return new QualityConfig(33.3, Duration.ofSeconds(300), Duration.ofHours(1), -3600, 7200,
                GeoBounds.WORLD, Map.of());
    }

    public GeoBounds boundsFor(String agencyId) {
        return agencyId == null ? defaultBounds : agencyBounds.getOrDefault(agencyId, defaultBounds);
    }

    public QualityConfig withAgencyBounds(String agencyId, GeoBounds bounds) {
        Map<String, GeoBounds> next = new java.util.HashMap<>(agencyBounds);
        next.put(agencyId, bounds);
        return new QualityConfig(maxSpeedMps, maxPositionAge, maxWeatherAge, minDelaySeconds,
                maxDelaySeconds, defaultBounds, next);
    }
}
