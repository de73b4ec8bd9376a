package transit.sentinel.ingestor;

import org.apache.kafka.connect.source.SourceRecord;
import org.apache.kafka.connect.source.SourceTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transit.sentinel.enrichment.weather.OpenMeteoWeatherApi;
import transit.sentinel.enrichment.weather.TtlCache;
import transit.sentinel.enrichment.weather.WeatherEnrichment;
import transit.sentinel.ingestor.decoder.DecodedFeed;
import transit.sentinel.ingestor.decoder.FeedDecodeException;
import transit.sentinel.ingestor.decoder.FeedDecoder;
import transit.sentinel.ingestor.fetcher.FeedFetcher;
import transit.sentinel.ingestor.fetcher.FetchProfile;
import transit.sentinel.ingestor.fetcher.HttpFeedFetcher;
import transit.sentinel.ingestor.pipeline.PipelineStats;
import transit.sentinel.ingestor.pipeline.TransitPipeline;
import transit.sentinel.ingestor.sink.SourceRecordSink;
import transit.sentinel.lakehouse.DuckDbLayeredStore;
import transit.sentinel.lakehouse.LayeredStore;
import transit.sentinel.lakehouse.StorageException;
import transit.sentinel.quality.QualityGate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class FeedSourceTask extends SourceTask {
    private static final Logger log = LoggerFactory.getLogger(FeedSourceTask.class);

    static final String OFFSET_HEADER_TS = "lastHeaderTs";
    static final String OFFSET_FETCH_MS = "lastFetchMs";

    private static final int WEATHER_CACHE_ENTRIES = 256;
    private static final Duration WEATHER_TIMEOUT = Duration.ofSeconds(10);

    private final FeedFetcher http;

    private String name;
    private String url;
    private int intervalSeconds;
    private FetchProfile fetchProfile;

    private long nextAtMs;
    private FeedDecoder decoder;
    private LayeredStore store;
    private SourceRecordSink sink;
    private TransitPipeline pipeline;

    private long lastHeaderTsSeen = -1L;

    public FeedSourceTask() {
        this(new HttpFeedFetcher());
    }

    FeedSourceTask(FeedFetcher http) {
        this.http = http;
    }

    @Override
    public String version() {
        return "1.0";
    }

    @Override
    public void start(Map<String, String> props) {
        FeedSourceConfig cfg = FeedSourceConfig.parse(props);
        this.name = cfg.feedName();
        this.url = cfg.feedUrl();
        this.intervalSeconds = cfg.intervalSeconds();
        this.fetchProfile = cfg.fetchProfile();

        Clock clock = Clock.systemUTC();
        QualityGate gate = new QualityGate(cfg.qualityConfig(), clock);
        this.decoder = new FeedDecoder(cfg.agencyId(), clock);
        this.store = DuckDbLayeredStore.open(cfg.storeConfig(), gate);
        this.sink = new SourceRecordSink(name, cfg.topics());

        WeatherEnrichment weather = null;
        if (cfg.weatherEnabled()) {
            weather = new WeatherEnrichment(
                    new OpenMeteoWeatherApi(cfg.weatherBaseUrl(), WEATHER_TIMEOUT),
                    new TtlCache<>(WEATHER_CACHE_ENTRIES, cfg.weatherCacheTtl(), clock));
        }
        this.pipeline = new TransitPipeline(decoder, gate, store, sink, weather, cfg.pipelineConfig(), clock);

        this.nextAtMs = System.currentTimeMillis();
        this.lastHeaderTsSeen = storedHeaderTs();
        log.info("Feed {} started for agency {} every {}s (last header ts {})",
                name, cfg.agencyId(), intervalSeconds, lastHeaderTsSeen);
    }

    private long storedHeaderTs() {
        if (context == null) {
            return -1L;
        }
        try {
            Map<String, Object> off = context.offsetStorageReader().offset(sink.sourcePartition());
            if (off != null) {
                Object ts = off.get(OFFSET_HEADER_TS);
                if (ts instanceof Number) return ((Number) ts).longValue();
            }
        } catch (RuntimeException e) {
            log.warn("Could not read stored offset for feed {}, starting without one: {}", name, e.getMessage());
        }
        return -1L;
    }

    @Override
    public List<SourceRecord> poll() throws InterruptedException {
        long nowMs = System.currentTimeMillis();
        if (nowMs < nextAtMs) {
            Thread.sleep(Math.min(1000L, nextAtMs - nowMs));
            return null;
        }

        final long callStartMs = System.currentTimeMillis();
        try {
            pipeline.resumePending();

            byte[] bytes = http.fetch(url, fetchProfile);
            if (bytes == null) {
                log.debug("Feed {} not modified", name);
                return sink.drain();
            }

            DecodedFeed feed = decoder.decode(bytes);
            long headerTs = feed.headerTimestamp();
            if (headerTs > 0 && headerTs == lastHeaderTsSeen) {
                log.debug("Feed {} header ts {} already processed", name, headerTs);
                return sink.drain();
            }

            Map<String, Object> offset = new HashMap<>();
            if (headerTs > 0) offset.put(OFFSET_HEADER_TS, headerTs);
            offset.put(OFFSET_FETCH_MS, System.currentTimeMillis());
            sink.beginCycle(offset);

            // a failed cycle stays pending and is finished before the next fetch
            if (headerTs > 0) lastHeaderTsSeen = headerTs;
            pipeline.process(feed);
        } catch (FeedDecodeException | IOException e) {
            pipeline.stats().recordFailure();
            log.warn("Feed {} poll failed: {}", name, e.getMessage());
        } catch (StorageException e) {
            log.warn("Feed {} cycle left pending: {}", name, e.getMessage());
        } finally {
            scheduleNext(callStartMs);
        }
        return sink.drain();
    }

    PipelineStats.Snapshot stats() {
        return pipeline.stats().snapshot();
    }

    private void scheduleNext(long callStartMs) {
        long elapsed = Math.max(1, System.currentTimeMillis() - callStartMs);
        long sleepMs = Math.max(50L, intervalSeconds * 1000L - elapsed);
        nextAtMs = System.currentTimeMillis() + sleepMs;
    }

    @Override
    public void stop() {
        if (store != null) {
            PipelineStats.Snapshot s = pipeline.stats().snapshot();
            log.info("Feed {} stopping: polls={} ok={} failed={} success={}% valid={}%", name,
                    s.totalPolls(), s.successfulPolls(), s.failedPolls(),
                    String.format("%.1f", s.successRate()), String.format("%.1f", s.validationRate()));
            store.close();
        }
    }
}
