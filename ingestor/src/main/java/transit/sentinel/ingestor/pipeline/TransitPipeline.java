package transit.sentinel.ingestor.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transit.sentinel.enrichment.weather.WeatherEnrichment;
import transit.sentinel.ingestor.decoder.DecodedFeed;
import transit.sentinel.ingestor.decoder.FeedDecodeException;
import transit.sentinel.ingestor.decoder.FeedDecoder;
import transit.sentinel.ingestor.sink.EventSink;
import transit.sentinel.lakehouse.LayeredStore;
import transit.sentinel.lakehouse.PromotionSummary;
import transit.sentinel.lakehouse.RawBatch;
import transit.sentinel.model.QualityAlert;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;
import transit.sentinel.quality.QualityAlerts;
import transit.sentinel.quality.QualityGate;
import transit.sentinel.quality.ValidationResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one poll cycle end to end: decode, validate, append raw, record alerts, publish, promote and
 * (every N cycles) aggregate. A cycle that fails after decoding is kept with the stage it failed at;
 * the next call finishes it with the same batch before taking new input, so no stage runs twice.
 *
 * <p>Not thread-safe. One pipeline belongs to one poll loop.
 */
public class TransitPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransitPipeline.class);

    private final FeedDecoder decoder;
    private final QualityGate gate;
    private final LayeredStore store;
    private final EventSink sink;
    private final WeatherEnrichment weather;
    private final PipelineConfig config;
    private final Clock clock;

    private final PipelineStats stats = new PipelineStats();
    private long cycles;
    private Instant lastWeatherFetch;
    private Cycle pending;

    public TransitPipeline(FeedDecoder decoder, QualityGate gate, LayeredStore store, EventSink sink,
                           PipelineConfig config) {
        this(decoder, gate, store, sink, null, config, Clock.systemUTC());
    }

    /**
     * @param weather enrichment collaborator, may be {@code null} when the config has no weather site
     */
    public TransitPipeline(FeedDecoder decoder, QualityGate gate, LayeredStore store, EventSink sink,
                           WeatherEnrichment weather, PipelineConfig config, Clock clock) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (config.weatherEnabled() && weather == null) {
            throw new IllegalArgumentException("weather site configured without a weather enrichment");
        }
        this.weather = weather;
    }

    public PipelineStats stats() {
        return stats;
    }

    public boolean hasPending() {
        return pending != null;
    }

    public CycleResult process(byte[] bytes) throws FeedDecodeException {
        resumePending();
        DecodedFeed feed;
        try {
            feed = decoder.decode(bytes);
        } catch (FeedDecodeException e) {
            stats.recordFailure();
            log.error("Decode failed, cycle skipped: {}", e.getMessage());
            throw e;
        }
        return process(feed);
    }

    public CycleResult process(DecodedFeed feed) {
        resumePending();
        Cycle cycle = prepare(feed);
        pending = cycle;
        return run(cycle);
    }

    /**
     * Finishes a previously failed cycle, if any.
     *
     * @throws RuntimeException the stage failed again; the cycle stays pending
     */
    public Optional<CycleResult> resumePending() {
        if (pending == null) {
            return Optional.empty();
        }
        log.info("Resuming cycle {} at stage {}", pending.number, pending.stage);
        pending.resumed = true;
        return Optional.of(run(pending));
    }

    private Cycle prepare(DecodedFeed feed) {
        Instant now = clock.instant();
        long number = ++cycles;
        Cycle c = new Cycle(number, number % config.aggregateEvery() == 0);

        List<ValidationResult<VehiclePosition>> positions = validateAll(feed.positions(), p -> gate.validate(p, now));
        List<ValidationResult<TripUpdate>> updates = validateAll(feed.tripUpdates(), u -> gate.validate(u, now));

        List<WeatherObservation> observed = fetchWeather(feed.positions(), now);
        List<ValidationResult<WeatherObservation>> weatherResults =
                validateAll(observed, w -> gate.validate(w, now));

        c.batch = new RawBatch(feed.positions(), feed.tripUpdates(), observed, now);
        c.weatherFetched = !observed.isEmpty();
        c.positions = accepted(positions, c, now);
        c.tripUpdates = accepted(updates, c, now);
        c.weather = accepted(weatherResults, c, now);

        log.debug("Cycle {} prepared: {} (decode {})", c.number, c.batch.size(), feed.stats());
        return c;
    }

    private <T> List<ValidationResult<T>> validateAll(List<T> records, Function<T, ValidationResult<T>> check) {
        return records.parallelStream().map(check).collect(Collectors.toList());
    }

    private <T> List<T> accepted(List<ValidationResult<T>> results, Cycle c, Instant now) {
        List<T> out = new ArrayList<>(results.size());
        for (ValidationResult<T> r : results) {
            if (r.isAccepted()) {
                out.add(r.record());
                continue;
            }
            QualityAlert alert = QualityAlerts.of(r, now);
            log.warn("Rejected {} {} ({}): {}", alert.entityType().label(), alert.entityId(),
                    r.rejection().rule(), alert.errorMessage());
            c.alerts.add(alert);
        }
        return out;
    }

    private List<WeatherObservation> fetchWeather(List<VehiclePosition> positions, Instant now) {
        if (!config.weatherEnabled()) {
            return List.of();
        }
        if (lastWeatherFetch != null && Duration.between(lastWeatherFetch, now).compareTo(config.weatherInterval()) < 0) {
            return List.of();
        }
        lastWeatherFetch = now;
        PipelineConfig.WeatherSite site = config.weatherSite();
        return weather.correlateWithVehicles(positions, site.latitude(), site.longitude(), decoder.agencyId())
                .map(List::of)
                .orElse(List.of());
    }

    private CycleResult run(Cycle c) {
        try {
            while (c.stage != Stage.DONE) {
                runStage(c);
                c.stage = c.stage.next();
            }
        } catch (RuntimeException e) {
            stats.recordFailure();
            log.error("Cycle {} failed at stage {}, will resume on next call: {}", c.number, c.stage, e.getMessage());
            throw e;
        }
        pending = null;

        CycleResult result = c.result();
        stats.recordSuccess(result);
        log.info("Cycle {}: decoded={} accepted={} rejected={} raw={} promoted={} aggregateRows={}",
                result.cycle(), result.decoded(), result.accepted(), result.rejected(), result.rawAppended(),
                result.promotion().promotedTotal(), result.aggregateRows());
        return result;
    }

    private void runStage(Cycle c) {
        switch (c.stage) {
            case APPEND_RAW -> c.rawAppended = store.appendRaw(c.batch);
            case RECORD_ALERTS -> c.alertsRecorded = c.alerts.isEmpty() ? 0 : store.recordAlerts(c.alerts);
            case PUBLISH -> {
                sink.publishPositions(c.positions);
                sink.publishTripUpdates(c.tripUpdates);
                sink.publishWeather(c.weather);
                sink.publishAlerts(c.alerts);
            }
            case PROMOTE -> c.promotion = store.promote();
            case AGGREGATE -> {
                if (c.aggregate) {
                    c.aggregateRows = store.aggregateWindow(config.bucketSize()) + store.aggregateRoutePerformance();
                }
            }
        }
    }

    private static final class Cycle {
        final long number;
        final boolean aggregate;
        final List<QualityAlert> alerts = new ArrayList<>();
        RawBatch batch;
        List<VehiclePosition> positions;
        List<TripUpdate> tripUpdates;
        List<WeatherObservation> weather;
        boolean weatherFetched;

        Stage stage = Stage.APPEND_RAW;
        boolean resumed;
        int rawAppended;
        int alertsRecorded;
        PromotionSummary promotion;
        int aggregateRows;

        Cycle(long number, boolean aggregate) {
            this.number = number;
            this.aggregate = aggregate;
        }

        CycleResult result() {
            int accepted = positions.size() + tripUpdates.size() + weather.size();
            return new CycleResult(number, batch.size(), accepted, alerts.size(), rawAppended, alertsRecorded,
                    promotion, aggregate, aggregateRows, weatherFetched, resumed);
        }
    }
}
