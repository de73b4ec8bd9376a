package transit.sentinel.ingestor.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * @param aggregateEvery run aggregation after every N-th completed cycle
 * @param bucketSize vehicle metrics bucket
 * @param weatherSite where to sample weather for the fleet; {@code null} disables weather
 * @param weatherInterval minimum time between weather fetches
 */
public record PipelineConfig(
        int aggregateEvery,
        Duration bucketSize,
        WeatherSite weatherSite,
        Duration weatherInterval
) {
    public record WeatherSite(double latitude, double longitude) {
        public WeatherSite {
            if (latitude < -90 || latitude > 90) throw new IllegalArgumentException("latitude out of range: " + latitude);
            if (longitude < -180 || longitude > 180) throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }

    public PipelineConfig {
        if (aggregateEvery < 1) throw new IllegalArgumentException("aggregateEvery must be >= 1");
        Objects.requireNonNull(bucketSize, "bucketSize");
        Objects.requireNonNull(weatherInterval, "weatherInterval");
        if (weatherInterval.isNegative()) throw new IllegalArgumentException("weatherInterval must be >= 0");
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(1, Duration.ofHours(1), null, Duration.ofMinutes(5));
    }

    public PipelineConfig withWeather(double latitude, double longitude, Duration interval) {
        return new PipelineConfig(aggregateEvery, bucketSize, new WeatherSite(latitude, longitude), interval);
    }

    public PipelineConfig withAggregation(int every, Duration bucket) {
        return new PipelineConfig(every, bucket, weatherSite, weatherInterval);
    }

    public boolean weatherEnabled() {
        return weatherSite != null;
    }
}
