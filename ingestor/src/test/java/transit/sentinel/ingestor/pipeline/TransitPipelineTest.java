package transit.sentinel.ingestor.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import transit.sentinel.enrichment.weather.CurrentWeather;
import transit.sentinel.enrichment.weather.HourlyForecast;
import transit.sentinel.enrichment.weather.TtlCache;
import transit.sentinel.enrichment.weather.WeatherApi;
import transit.sentinel.enrichment.weather.WeatherEnrichment;
import transit.sentinel.ingestor.decoder.FeedDecodeException;
import transit.sentinel.ingestor.decoder.FeedDecoder;
import transit.sentinel.ingestor.support.MutableClock;
import transit.sentinel.ingestor.support.RecordingSink;
import transit.sentinel.lakehouse.DuckDbLayeredStore;
import transit.sentinel.lakehouse.StorageException;
import transit.sentinel.lakehouse.StoreConfig;
import transit.sentinel.model.AlertType;
import transit.sentinel.quality.QualityConfig;
import transit.sentinel.quality.QualityGate;

import java.sql.DriverManager;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static transit.sentinel.ingestor.support.GtfsFeeds.feed;
import static transit.sentinel.ingestor.support.GtfsFeeds.stop;
import static transit.sentinel.ingestor.support.GtfsFeeds.tripUpdate;
import static transit.sentinel.ingestor.support.GtfsFeeds.vehicle;

class TransitPipelineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:30:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    private MutableClock clock;
    private QualityGate gate;
    private FlakyStore store;
    private RecordingSink sink;
    private FeedDecoder decoder;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(NOW);
        gate = new QualityGate(QualityConfig.defaults(), clock);
        store = new FlakyStore(new DuckDbLayeredStore(DriverManager.getConnection(StoreConfig.IN_MEMORY_URL),
                gate, StoreConfig.inMemory(), clock));
        sink = new RecordingSink();
        decoder = new FeedDecoder("trimet", clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private TransitPipeline pipeline(PipelineConfig config) {
        return new TransitPipeline(decoder, gate, store, sink, null, config, clock);
    }

    private byte[] mixedFeed() {
        long t = NOW.getEpochSecond();
        return feed(NOW)
                .addEntity(vehicle("4012", "100", 45.5152, -122.6784, 12.5f, NOW.minusSeconds(15)))
                .addEntity(vehicle("4013", "100", 45.5200, -122.6700, 40f, NOW.minusSeconds(15)))
                .addEntity(tripUpdate("T-1", "100",
                        stop(1, "s1", 0, t + 60, t + 90),
                        stop(2, "s2", 120, t + 300, t + 330)))
                .build().toByteArray();
    }

    private byte[] singleVehicle(String id, Instant ts) {
        return feed(ts).addEntity(vehicle(id, "100", 45.5152, -122.6784, 10f, ts)).build().toByteArray();
    }

    @Test
    void runsOneCycleEndToEnd() throws Exception {
        CycleResult result = pipeline(PipelineConfig.defaults()).process(mixedFeed());

        assertEquals(1, result.cycle());
        assertEquals(4, result.decoded());
        assertEquals(3, result.accepted());
        assertEquals(1, result.rejected());
        assertEquals(4, result.rawAppended());
        assertEquals(1, result.alertsRecorded());
        assertEquals(1, result.promotion().positions().promoted());
        assertEquals(2, result.promotion().tripUpdates().promoted());
        assertTrue(result.aggregated());
        assertFalse(result.resumed());

        assertEquals(1, sink.positions.size());
        assertEquals("4012", sink.positions.get(0).vehicleId());
        assertEquals(2, sink.tripUpdates.size());
        assertEquals(1, sink.alerts.size());
        assertEquals(AlertType.SPEED_VIOLATION, sink.alerts.get(0).alertType());
        assertEquals("4013", sink.alerts.get(0).entityId());

        assertEquals(1, store.metrics().totalAlerts());
        assertEquals(1, store.latestVehicleMetrics("trimet", HOUR, 10).size());
        assertEquals(1, store.routePerformance("trimet").size());
    }

    @Test
    void aggregatesOnlyEveryNthCycle() throws Exception {
        TransitPipeline pipeline = pipeline(PipelineConfig.defaults().withAggregation(2, HOUR));

        CycleResult first = pipeline.process(singleVehicle("1", NOW.minusSeconds(5)));
        assertFalse(first.aggregated());
        assertEquals(0, first.aggregateRows());
        assertTrue(store.latestVehicleMetrics("trimet", HOUR, 10).isEmpty());

        CycleResult second = pipeline.process(singleVehicle("2", NOW.minusSeconds(4)));
        assertTrue(second.aggregated());
        assertEquals(2, store.latestVehicleMetrics("trimet", HOUR, 10).get(0).totalVehicles());
    }

    @Test
    void failedPromotionResumesWithoutReappending() throws Exception {
        TransitPipeline pipeline = pipeline(PipelineConfig.defaults());
        store.failNext(FlakyStore.Op.PROMOTE, 1);

        assertThrows(StorageException.class, () -> pipeline.process(singleVehicle("1", NOW.minusSeconds(5))));
        assertTrue(pipeline.hasPending());
        assertEquals(1, sink.positions.size());
        assertEquals(0, store.metrics().validatedVehiclePositions());

        CycleResult next = pipeline.process(singleVehicle("2", NOW.minusSeconds(4)));

        assertFalse(pipeline.hasPending());
        assertEquals(2, next.cycle());
        assertEquals(2, store.appendCalls.get());
        assertEquals(2, store.metrics().rawVehiclePositions());
        assertEquals(2, store.metrics().validatedVehiclePositions());
        assertEquals(2, sink.positions.size());

        PipelineStats.Snapshot stats = pipeline.stats().snapshot();
        assertEquals(1, stats.failedPolls());
        assertEquals(2, stats.successfulPolls());
    }

    @Test
    void failedAppendRetriesTheSameBatch() throws Exception {
        TransitPipeline pipeline = pipeline(PipelineConfig.defaults());
        store.failNext(FlakyStore.Op.APPEND_RAW, 2);

        assertThrows(StorageException.class, () -> pipeline.process(singleVehicle("1", NOW.minusSeconds(5))));
        assertThrows(StorageException.class, pipeline::resumePending);
        assertEquals(0, store.metrics().rawVehiclePositions());
        assertTrue(sink.positions.isEmpty());

        Optional<CycleResult> resumed = pipeline.resumePending();

        assertTrue(resumed.isPresent());
        assertTrue(resumed.get().resumed());
        assertEquals(1, resumed.get().rawAppended());
        assertEquals(1, store.metrics().validatedVehiclePositions());
        assertEquals(1, sink.positions.size());
        assertTrue(pipeline.resumePending().isEmpty());
    }

    @Test
    void resumedAppendKeepsTheValidationTime() throws Exception {
        TransitPipeline pipeline = pipeline(PipelineConfig.defaults());
        store.failNext(FlakyStore.Op.APPEND_RAW, 1);

        assertThrows(StorageException.class, () -> pipeline.process(singleVehicle("1", NOW.minusSeconds(5))));
        clock.advance(Duration.ofMinutes(6));

        CycleResult resumed = pipeline.resumePending().orElseThrow();

        assertEquals(1, resumed.accepted());
        assertEquals(0, resumed.rejected());
        assertEquals(1, resumed.promotion().positions().promoted());
        assertTrue(resumed.promotion().positions().rejected().isEmpty());
        assertEquals(1, sink.positions.size());
        assertEquals(1, store.metrics().validatedVehiclePositions());
        assertEquals(0, store.metrics().totalAlerts());
    }

    @Test
    void decodeFailureSkipsTheCycle() {
        TransitPipeline pipeline = pipeline(PipelineConfig.defaults());

        assertThrows(FeedDecodeException.class, () -> pipeline.process(new byte[]{1, 2, 3}));

        assertFalse(pipeline.hasPending());
        assertEquals(0, store.appendCalls.get());
        assertEquals(1, pipeline.stats().snapshot().failedPolls());
    }

    @Test
    void fetchesWeatherOnItsOwnInterval() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        WeatherApi api = new WeatherApi() {
            @Override
            public Optional<CurrentWeather> current(double latitude, double longitude) {
                calls.incrementAndGet();
                return Optional.of(new CurrentWeather(14.0, 12.0, 0.4, 61, clock.instant()));
            }

            @Override
            public List<HourlyForecast> hourly(double latitude, double longitude, int hoursAhead) {
                return List.of();
            }
        };
        WeatherEnrichment weather = new WeatherEnrichment(api, new TtlCache<>(16, Duration.ofMinutes(5), clock));
        TransitPipeline pipeline = new TransitPipeline(decoder, gate, store, sink, weather,
                PipelineConfig.defaults().withWeather(45.52, -122.68, Duration.ofMinutes(10)), clock);

        CycleResult first = pipeline.process(singleVehicle("1", NOW.minusSeconds(5)));
        clock.advance(Duration.ofMinutes(1));
        CycleResult second = pipeline.process(singleVehicle("2", clock.instant().minusSeconds(5)));
        clock.advance(Duration.ofMinutes(10));
        CycleResult third = pipeline.process(singleVehicle("3", clock.instant().minusSeconds(5)));

        assertTrue(first.weatherFetched());
        assertFalse(second.weatherFetched());
        assertTrue(third.weatherFetched());
        assertEquals(2, calls.get());
        assertEquals(2, sink.weather.size());
        assertEquals(1, first.promotion().weather().promoted());
    }

    @Test
    void weatherWithoutEnrichmentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TransitPipeline(decoder, gate, store, sink, null,
                PipelineConfig.defaults().withWeather(45.52, -122.68, HOUR), clock));
    }
}
