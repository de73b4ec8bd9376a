package transit.sentinel.ingestor;

import org.apache.kafka.common.config.ConfigException;
import org.junit.jupiter.api.Test;
import transit.sentinel.ingestor.fetcher.FetchProfile;
import transit.sentinel.ingestor.pipeline.PipelineConfig;
import transit.sentinel.lakehouse.StoreConfig;
import transit.sentinel.quality.GeoBounds;
import transit.sentinel.quality.QualityConfig;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedSourceConfigTest {

    private static Map<String, String> minimal() {
        Map<String, String> props = new HashMap<>();
        props.put(FeedSourceConnector.CFG_FEED_URL, "https://developer.trimet.org/ws/V1/VehiclePositions");
        props.put(FeedSourceConnector.CFG_FEED_AGENCY, "trimet");
        return props;
    }

    @Test
    void defaultsMatchTheLibraryDefaults() {
        FeedSourceConfig cfg = FeedSourceConfig.parse(minimal());

        assertEquals("gtfs-rt", cfg.feedName());
        assertEquals(30, cfg.intervalSeconds());
        assertEquals("transit.vehicle-positions", cfg.topics().positions());
        assertEquals("transit.quality-alerts", cfg.topics().alerts());
        assertEquals(StoreConfig.IN_MEMORY_URL, cfg.storeConfig().jdbcUrl());
        assertEquals(Duration.ofMinutes(10), cfg.storeConfig().promotionWindow());

        QualityConfig q = cfg.qualityConfig();
        assertEquals(33.3, q.maxSpeedMps(), 1e-9);
        assertEquals(Duration.ofSeconds(300), q.maxPositionAge());
        assertEquals(GeoBounds.WORLD, q.boundsFor("trimet"));

        PipelineConfig p = cfg.pipelineConfig();
        assertEquals(1, p.aggregateEvery());
        assertEquals(Duration.ofHours(1), p.bucketSize());
        assertFalse(p.weatherEnabled());

        assertEquals(FetchProfile.defaults(), cfg.fetchProfile());
    }

    @Test
    void missingFeedUrlFailsFast() {
        Map<String, String> props = minimal();
        props.remove(FeedSourceConnector.CFG_FEED_URL);

        assertThrows(ConfigException.class, () -> FeedSourceConfig.parse(props));
        assertThrows(ConfigException.class, () -> new FeedSourceConnector().start(props));
    }

    @Test
    void appliesOverrides() {
        Map<String, String> props = minimal();
        props.put(FeedSourceConnector.CFG_STORE_PATH, "/var/lib/transit/lake.duckdb");
        props.put(FeedSourceConnector.CFG_QUALITY_MAX_SPEED, "25.0");
        props.put(FeedSourceConnector.CFG_QUALITY_GEO_BOUNDS, "45.2,-123.2,45.7,-122.3");
        props.put(FeedSourceConnector.CFG_AGGREGATE_BUCKET_SEC, "900");
        props.put(FeedSourceConnector.CFG_AGGREGATE_EVERY, "3");
        props.put(FeedSourceConnector.CFG_WEATHER_ENABLED, "true");
        props.put(FeedSourceConnector.CFG_WEATHER_LATITUDE, "45.5152");
        props.put(FeedSourceConnector.CFG_WEATHER_LONGITUDE, "-122.6784");
        props.put(FeedSourceConnector.CFG_FETCH_PROFILE, "trafiklab");
        props.put(FeedSourceConnector.CFG_FETCH_HEADERS, "X-Api-Key=abc; X-Trace:1");
        props.put(FeedSourceConnector.CFG_FETCH_CONDITIONAL_GET, "false");
        props.put(FeedSourceConnector.CFG_FETCH_RETRIES, "5");
        props.put(FeedSourceConnector.CFG_FETCH_BACKOFF_MS, "250");

        FeedSourceConfig cfg = FeedSourceConfig.parse(props);

        assertEquals("jdbc:duckdb:/var/lib/transit/lake.duckdb", cfg.storeConfig().jdbcUrl());
        assertEquals(25.0, cfg.qualityConfig().maxSpeedMps(), 1e-9);
        assertFalse(cfg.qualityConfig().boundsFor("trimet").contains(40.7, -74.0));
        assertTrue(cfg.qualityConfig().boundsFor("trimet").contains(45.5152, -122.6784));

        PipelineConfig p = cfg.pipelineConfig();
        assertEquals(3, p.aggregateEvery());
        assertEquals(Duration.ofMinutes(15), p.bucketSize());
        assertEquals(45.5152, p.weatherSite().latitude(), 1e-9);

        FetchProfile f = cfg.fetchProfile();
        assertEquals(FetchProfile.trafiklab().userAgent(), f.userAgent());
        assertEquals(Map.of("X-Api-Key", "abc", "X-Trace", "1"), f.headers());
        assertFalse(f.conditionalGet());
        assertEquals(5, f.maxAttempts());
        assertEquals(Duration.ofMillis(250), f.initialBackoff());
    }

    @Test
    void weatherNeedsCoordinates() {
        Map<String, String> props = minimal();
        props.put(FeedSourceConnector.CFG_WEATHER_ENABLED, "true");
        props.put(FeedSourceConnector.CFG_WEATHER_LATITUDE, "45.5");

        assertThrows(ConfigException.class, () -> FeedSourceConfig.parse(props));
    }

    @Test
    void rejectsBadValues() {
        Map<String, String> interval = minimal();
        interval.put(FeedSourceConnector.CFG_INTERVAL_SEC, "0");
        assertThrows(ConfigException.class, () -> FeedSourceConfig.parse(interval));

        Map<String, String> bounds = minimal();
        bounds.put(FeedSourceConnector.CFG_QUALITY_GEO_BOUNDS, "45.2,-123.2");
        assertThrows(ConfigException.class, () -> FeedSourceConfig.parse(bounds).qualityConfig());

        Map<String, String> dec = minimal();
        dec.put(FeedSourceConnector.CFG_FETCH_DECOMPRESSION, "brotli");
        assertThrows(ConfigException.class, () -> FeedSourceConfig.parse(dec).fetchProfile());
    }

    @Test
    void connectorHandsEachTaskTheFullConfig() {
        FeedSourceConnector connector = new FeedSourceConnector();
        connector.start(minimal());

        assertEquals(1, connector.taskConfigs(4).size());
        assertEquals("trimet", connector.taskConfigs(1).get(0).get(FeedSourceConnector.CFG_FEED_AGENCY));
        assertEquals(FeedSourceTask.class, connector.taskClass());
        assertNull(connector.config().configKeys().get(FeedSourceConnector.CFG_QUALITY_GEO_BOUNDS).defaultValue);
    }
}
