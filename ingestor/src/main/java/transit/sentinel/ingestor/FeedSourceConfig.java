package transit.sentinel.ingestor;

import org.apache.kafka.common.config.ConfigException;
import transit.sentinel.ingestor.fetcher.FetchProfile;
import transit.sentinel.ingestor.pipeline.PipelineConfig;
import transit.sentinel.ingestor.sink.SourceRecordSink;
import transit.sentinel.lakehouse.StoreConfig;
import transit.sentinel.quality.GeoBounds;
import transit.sentinel.quality.QualityConfig;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import static transit.sentinel.ingestor.FeedSourceConnector.*;

/**
 * Typed view of the connector properties. Parsing goes through {@link FeedSourceConnector#CONFIG_DEF},
 * so missing required keys and out-of-range values fail with a {@link ConfigException}.
 */
public final class FeedSourceConfig {

    private final Map<String, Object> values;

    private FeedSourceConfig(Map<String, Object> values) {
        this.values = values;
    }

    public static FeedSourceConfig parse(Map<String, String> props) {
        FeedSourceConfig cfg = new FeedSourceConfig(CONFIG_DEF.parse(props));
        if (cfg.weatherEnabled() && (cfg.values.get(CFG_WEATHER_LATITUDE) == null
                || cfg.values.get(CFG_WEATHER_LONGITUDE) == null)) {
            throw new ConfigException(CFG_WEATHER_ENABLED + " requires " + CFG_WEATHER_LATITUDE
                    + " and " + CFG_WEATHER_LONGITUDE);
        }
        return cfg;
    }

    public String feedName() {
        return string(CFG_FEED_NAME);
    }

    public String feedUrl() {
        return string(CFG_FEED_URL);
    }

    public String agencyId() {
        return string(CFG_FEED_AGENCY);
    }

    public int intervalSeconds() {
        return integer(CFG_INTERVAL_SEC);
    }

    public SourceRecordSink.Topics topics() {
        return new SourceRecordSink.Topics(
                string(CFG_TOPIC_POSITIONS),
                string(CFG_TOPIC_TRIP_UPDATES),
                string(CFG_TOPIC_WEATHER),
                string(CFG_TOPIC_ALERTS));
    }

    public StoreConfig storeConfig() {
        return StoreConfig.file(string(CFG_STORE_PATH))
                .withPromotionWindow(Duration.ofSeconds(integer(CFG_STORE_PROMOTION_WINDOW_SEC)));
    }

    public QualityConfig qualityConfig() {
        QualityConfig d = QualityConfig.defaults();
        QualityConfig cfg = new QualityConfig(
                (Double) values.get(CFG_QUALITY_MAX_SPEED),
                Duration.ofSeconds(integer(CFG_QUALITY_MAX_AGE_SEC)),
                d.maxWeatherAge(),
                d.minDelaySeconds(),
                d.maxDelaySeconds(),
                d.defaultBounds(),
                Map.of());
        String bounds = string(CFG_QUALITY_GEO_BOUNDS);
        if (bounds == null || bounds.isBlank()) {
            return cfg;
        }
        try {
            return cfg.withAgencyBounds(agencyId(), GeoBounds.parse(bounds));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(CFG_QUALITY_GEO_BOUNDS, bounds, e.getMessage());
        }
    }

    public PipelineConfig pipelineConfig() {
        PipelineConfig cfg = PipelineConfig.defaults().withAggregation(
                integer(CFG_AGGREGATE_EVERY),
                Duration.ofSeconds(integer(CFG_AGGREGATE_BUCKET_SEC)));
        if (!weatherEnabled()) {
            return cfg;
        }
        return cfg.withWeather(
                (Double) values.get(CFG_WEATHER_LATITUDE),
                (Double) values.get(CFG_WEATHER_LONGITUDE),
                Duration.ofSeconds(integer(CFG_WEATHER_INTERVAL_SEC)));
    }

    public boolean weatherEnabled() {
        return (Boolean) values.get(CFG_WEATHER_ENABLED);
    }

    public String weatherBaseUrl() {
        return string(CFG_WEATHER_BASE_URL);
    }

    public Duration weatherCacheTtl() {
        return Duration.ofSeconds(integer(CFG_WEATHER_CACHE_TTL_SEC));
    }

    /**
     * Named profile with any explicit fetch.* overrides applied on top.
     */
    public FetchProfile fetchProfile() {
        FetchProfile base = FetchProfile.named(string(CFG_FETCH_PROFILE));

        String accept = orDefault(string(CFG_FETCH_ACCEPT), base.accept());
        String acceptEnc = orDefault(string(CFG_FETCH_ACCEPT_ENCODING), base.acceptEncoding());
        Map<String, String> headers = values.get(CFG_FETCH_HEADERS) != null
                ? FetchProfile.parseHeaders(string(CFG_FETCH_HEADERS))
                : base.headers();
        Boolean conditional = (Boolean) values.get(CFG_FETCH_CONDITIONAL_GET);
        FetchProfile.Decompression dec = decompression(string(CFG_FETCH_DECOMPRESSION), base.decompression());
        Integer timeoutMs = (Integer) values.get(CFG_FETCH_TIMEOUT_MS);
        String userAgent = orDefault(string(CFG_FETCH_USER_AGENT), base.userAgent());
        Integer retries = (Integer) values.get(CFG_FETCH_RETRIES);
        Long backoffMs = (Long) values.get(CFG_FETCH_BACKOFF_MS);

        return new FetchProfile(
                accept,
                acceptEnc,
                headers,
                conditional == null ? base.conditionalGet() : conditional,
                dec,
                timeoutMs == null ? base.timeout() : Duration.ofMillis(timeoutMs),
                userAgent,
                retries == null ? base.maxAttempts() : retries,
                backoffMs == null ? base.initialBackoff() : Duration.ofMillis(backoffMs));
    }

    private static FetchProfile.Decompression decompression(String val, FetchProfile.Decompression def) {
        if (val == null || val.isBlank()) return def;
        try {
            return FetchProfile.Decompression.valueOf(val.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(CFG_FETCH_DECOMPRESSION, val, "expected AUTO|GZIP|DEFLATE|NONE|TRY_SMART");
        }
    }

    private static String orDefault(String val, String def) {
        return val == null ? def : val;
    }

    private String string(String key) {
        return (String) values.get(key);
    }

    private int integer(String key) {
        return (Integer) values.get(key);
    }
}
