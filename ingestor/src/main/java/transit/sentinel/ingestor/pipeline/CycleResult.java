package transit.sentinel.ingestor.pipeline;

import transit.sentinel.lakehouse.PromotionSummary;

/**
 * @param decoded records decoded from the feed, plus the weather observation when one was fetched
 * @param aggregateRows aggregate rows rewritten, 0 when this cycle did not aggregate
 * @param resumed true when the cycle had failed before and was finished by a later call
 */
public record CycleResult(
        long cycle,
        int decoded,
        int accepted,
        int rejected,
        int rawAppended,
        int alertsRecorded,
        PromotionSummary promotion,
        boolean aggregated,
        int aggregateRows,
        boolean weatherFetched,
        boolean resumed
) {
}
