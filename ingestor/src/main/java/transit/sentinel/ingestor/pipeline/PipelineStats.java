package transit.sentinel.ingestor.pipeline;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running poll counters for the lifetime of a pipeline.
 */
public final class PipelineStats {

    private final AtomicLong totalPolls = new AtomicLong();
    private final AtomicLong successfulPolls = new AtomicLong();
    private final AtomicLong failedPolls = new AtomicLong();
    private final AtomicLong entitiesProcessed = new AtomicLong();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public record Snapshot(long totalPolls, long successfulPolls, long failedPolls,
                           long entitiesProcessed, long accepted, long rejected) {

        /** Percent of polls that completed, 0 before the first poll. */
        public double successRate() {
            return totalPolls == 0 ? 0.0 : successfulPolls * 100.0 / totalPolls;
        }

        /** Percent of processed entities that passed the gate. */
        public double validationRate() {
            return entitiesProcessed == 0 ? 0.0 : accepted * 100.0 / entitiesProcessed;
        }
    }

    void recordSuccess(CycleResult result) {
        totalPolls.incrementAndGet();
        successfulPolls.incrementAndGet();
        entitiesProcessed.addAndGet(result.decoded());
        accepted.addAndGet(result.accepted());
        rejected.addAndGet(result.rejected());
    }

    /**
     * Counts a poll that produced nothing: fetch, decode or storage failure.
     */
    public void recordFailure() {
        totalPolls.incrementAndGet();
        failedPolls.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(totalPolls.get(), successfulPolls.get(), failedPolls.get(),
                entitiesProcessed.get(), accepted.get(), rejected.get());
    }
}
