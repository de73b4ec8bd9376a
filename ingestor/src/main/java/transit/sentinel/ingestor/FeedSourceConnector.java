package transit.sentinel.ingestor;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.connect.connector.Task;
import org.apache.kafka.connect.source.SourceConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transit.sentinel.enrichment.weather.OpenMeteoWeatherApi;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.apache.kafka.common.config.ConfigDef.Importance.HIGH;
import static org.apache.kafka.common.config.ConfigDef.Importance.LOW;
import static org.apache.kafka.common.config.ConfigDef.Importance.MEDIUM;
import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;
import static org.apache.kafka.common.config.ConfigDef.Type.BOOLEAN;
import static org.apache.kafka.common.config.ConfigDef.Type.DOUBLE;
import static org.apache.kafka.common.config.ConfigDef.Type.INT;
import static org.apache.kafka.common.config.ConfigDef.Type.LONG;
import static org.apache.kafka.common.config.ConfigDef.Type.STRING;

public class FeedSourceConnector extends SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(FeedSourceConnector.class);

    public static final String CFG_FEED_NAME = "feed.name";
    public static final String CFG_FEED_URL = "feed.url";
    public static final String CFG_FEED_AGENCY = "feed.agency";
    public static final String CFG_INTERVAL_SEC = "interval.seconds";

    public static final String CFG_TOPIC_POSITIONS = "topic.positions";
    public static final String CFG_TOPIC_TRIP_UPDATES = "topic.trip-updates";
    public static final String CFG_TOPIC_WEATHER = "topic.weather";
    public static final String CFG_TOPIC_ALERTS = "topic.alerts";

    public static final String CFG_STORE_PATH = "store.path";
    public static final String CFG_STORE_PROMOTION_WINDOW_SEC = "store.promotion.window.seconds";
    public static final String CFG_AGGREGATE_BUCKET_SEC = "aggregate.bucket.seconds";
    public static final String CFG_AGGREGATE_EVERY = "aggregate.every.cycles";

    public static final String CFG_QUALITY_MAX_SPEED = "quality.max.speed.mps";
    public static final String CFG_QUALITY_MAX_AGE_SEC = "quality.max.age.seconds";
    public static final String CFG_QUALITY_GEO_BOUNDS = "quality.geo.bounds";

    public static final String CFG_WEATHER_ENABLED = "weather.enabled";
    public static final String CFG_WEATHER_LATITUDE = "weather.latitude";
    public static final String CFG_WEATHER_LONGITUDE = "weather.longitude";
    public static final String CFG_WEATHER_INTERVAL_SEC = "weather.interval.seconds";
    public static final String CFG_WEATHER_BASE_URL = "weather.base.url";
    public static final String CFG_WEATHER_CACHE_TTL_SEC = "weather.cache.ttl.seconds";

    public static final String CFG_FETCH_PROFILE = "fetch.profile";
    public static final String CFG_FETCH_ACCEPT = "fetch.accept";
    public static final String CFG_FETCH_ACCEPT_ENCODING = "fetch.acceptEncoding";
    public static final String CFG_FETCH_HEADERS = "fetch.headers";
    public static final String CFG_FETCH_CONDITIONAL_GET = "fetch.conditionalGet";
    public static final String CFG_FETCH_DECOMPRESSION = "fetch.decompression";
    public static final String CFG_FETCH_TIMEOUT_MS = "fetch.timeout.ms";
    public static final String CFG_FETCH_USER_AGENT = "fetch.userAgent";
    public static final String CFG_FETCH_RETRIES = "fetch.retries";
    public static final String CFG_FETCH_BACKOFF_MS = "fetch.backoff.ms";

    public static final ConfigDef CONFIG_DEF = new ConfigDef()
            .define(CFG_FEED_NAME, STRING, "gtfs-rt", HIGH, "Logical feed name, used as the source partition")
            .define(CFG_FEED_URL, STRING, HIGH, "GTFS-RT feed URL (vehicle positions and/or trip updates)")
            .define(CFG_FEED_AGENCY, STRING, HIGH, "Agency id stamped on every record (e.g., trimet)")
            .define(CFG_INTERVAL_SEC, INT, 30, atLeast(1), MEDIUM, "Poll interval, seconds")

            .define(CFG_TOPIC_POSITIONS, STRING, "transit.vehicle-positions", HIGH, "Topic for accepted vehicle positions")
            .define(CFG_TOPIC_TRIP_UPDATES, STRING, "transit.trip-updates", HIGH, "Topic for accepted trip updates")
            .define(CFG_TOPIC_WEATHER, STRING, "transit.weather", MEDIUM, "Topic for accepted weather observations")
            .define(CFG_TOPIC_ALERTS, STRING, "transit.quality-alerts", HIGH, "Topic for quality alerts")

            .define(CFG_STORE_PATH, STRING, "", MEDIUM, "DuckDB database file; blank keeps the store in memory")
            .define(CFG_STORE_PROMOTION_WINDOW_SEC, INT, 600, atLeast(1), LOW,
                    "Raw records older than this at promotion time are not promoted")
            .define(CFG_AGGREGATE_BUCKET_SEC, INT, 3600, atLeast(1), MEDIUM, "Vehicle metrics bucket, seconds")
            .define(CFG_AGGREGATE_EVERY, INT, 1, atLeast(1), LOW, "Aggregate after every N poll cycles")

            .define(CFG_QUALITY_MAX_SPEED, DOUBLE, 33.3, MEDIUM, "Speed ceiling, metres per second")
            .define(CFG_QUALITY_MAX_AGE_SEC, INT, 300, atLeast(0), MEDIUM, "Maximum vehicle position age, seconds")
            .define(CFG_QUALITY_GEO_BOUNDS, STRING, null, LOW,
                    "Agency service area: \"minLat,minLon,maxLat,maxLon\"; unset accepts any valid coordinate")

            .define(CFG_WEATHER_ENABLED, BOOLEAN, false, MEDIUM, "Fetch weather for the service area")
            .define(CFG_WEATHER_LATITUDE, DOUBLE, null, LOW, "Service-area centre latitude")
            .define(CFG_WEATHER_LONGITUDE, DOUBLE, null, LOW, "Service-area centre longitude")
            .define(CFG_WEATHER_INTERVAL_SEC, INT, 300, atLeast(0), LOW, "Minimum time between weather fetches, seconds")
            .define(CFG_WEATHER_BASE_URL, STRING, OpenMeteoWeatherApi.DEFAULT_BASE_URL, LOW, "Open-Meteo API base URL")
            .define(CFG_WEATHER_CACHE_TTL_SEC, INT, 300, atLeast(1), LOW, "Weather cache TTL, seconds")

            .define(CFG_FETCH_PROFILE, STRING, "default", MEDIUM,
                    "Fetcher profile: default | trafiklab")
            .define(CFG_FETCH_ACCEPT, STRING, null, LOW,
                    "Override Accept header")
            .define(CFG_FETCH_ACCEPT_ENCODING, STRING, null, LOW,
                    "Override Accept-Encoding header")
            .define(CFG_FETCH_HEADERS, STRING, null, LOW,
                    "Extra headers: \"K=V,K2:V2\" (comma/semicolon separated; '=' or ':')")
            .define(CFG_FETCH_CONDITIONAL_GET, BOOLEAN, null, LOW,
                    "Use conditional GET (ETag/If-Modified-Since)")
            .define(CFG_FETCH_DECOMPRESSION, STRING, null, LOW,
                    "Decompression mode: AUTO|GZIP|DEFLATE|NONE|TRY_SMART")
            .define(CFG_FETCH_TIMEOUT_MS, INT, null, LOW,
                    "HTTP timeout in milliseconds")
            .define(CFG_FETCH_USER_AGENT, STRING, null, LOW,
                    "User-Agent override")
            .define(CFG_FETCH_RETRIES, INT, null, LOW,
                    "Total fetch attempts per poll, including the first")
            .define(CFG_FETCH_BACKOFF_MS, LONG, null, LOW,
                    "Backoff before the second attempt; doubled for each later one");

    private Map<String, String> configProps;

    @Override
    public String version() {
        return "1.0";
    }

    @Override
    public Class<? extends Task> taskClass() {
        return FeedSourceTask.class;
    }

    @Override
    public void start(Map<String, String> props) {
        FeedSourceConfig parsed = FeedSourceConfig.parse(props);
        log.info("Starting feed connector {} for {} at {}", parsed.feedName(), parsed.agencyId(), parsed.feedUrl());
        this.configProps = props;
    }

    @Override
    public void stop() {
    }

    /**
     * One task per feed: promotion state lives in the task's store.
     */
    @Override
    public List<Map<String, String>> taskConfigs(int maxTasks) {
        return List.of(new HashMap<>(configProps));
    }

    @Override
    public ConfigDef config() {
        return CONFIG_DEF;
    }
}
