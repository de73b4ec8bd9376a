package transit.sentinel.quality;

import transit.sentinel.model.ScheduleRelationship;
import transit.sentinel.model.TripUpdate;

import java.util.List;

public final class TripUpdateRules {

    private TripUpdateRules() {}

    public static List<QualityRule<TripUpdate>> build(QualityConfig cfg) {
        String delayBounds = "[" + cfg.minDelaySeconds() + ", " + cfg.maxDelaySeconds() + "]";
        return List.of(
                QualityRule.of("required-fields", (rule, u, now) -> {
                    if (Checks.blank(u.tripId())) return Checks.missing(rule, "trip_id");
                    if (Checks.blank(u.stopId())) return Checks.missing(rule, "stop_id");
                    if (u.stopSequence() == null) return Checks.missing(rule, "stop_sequence");
                    if (Checks.blank(u.agencyId())) return Checks.missing(rule, "agency_id");
                    if (u.timestamp() == null) return Checks.missing(rule, "timestamp");
                    return null;
                }),
                QualityRule.of("stop-sequence-range", (rule, u, now) -> {
                    if (u.stopSequence() < 0) {
                        return Checks.outOfRange(rule, "stop_sequence", u.stopSequence(), "[0, +inf)");
                    }
                    return null;
                }),
                QualityRule.of("schedule-relationship-known", (rule, u, now) -> {
                    if (u.scheduleRelationship() == ScheduleRelationship.UNKNOWN) {
                        return new Rejection(RejectionReason.UNKNOWN_ENUM_CODE, rule, "schedule_relationship",
                                u.scheduleRelationship().name(), "Unmapped schedule relationship code");
                    }
                    return null;
                }),
                QualityRule.of("arrival-before-departure", (rule, u, now) -> {
                    if (u.arrivalTime() != null && u.departureTime() != null
                            && u.arrivalTime().isAfter(u.departureTime())) {
                        return new Rejection(RejectionReason.SCHEDULE_ORDER_VIOLATION, rule, null, null,
                                "Arrival time " + u.arrivalTime() + " is after departure time " + u.departureTime());
                    }
                    return null;
                }),
                QualityRule.of("delay-bounds", (rule, u, now) -> {
                    Rejection r = delay(rule, "arrival_delay", u.arrivalDelay(), cfg, delayBounds);
                    return r != null ? r : delay(rule, "departure_delay", u.departureDelay(), cfg, delayBounds);
                })
        );
    }

    private static Rejection delay(String rule, String field, Integer value, QualityConfig cfg, String bounds) {
        if (value == null || (value >= cfg.minDelaySeconds() && value <= cfg.maxDelaySeconds())) {
            return null;
        }
        return new Rejection(RejectionReason.DELAY_OUT_OF_BOUNDS, rule, field, String.valueOf(value),
                "Delay " + value + "s outside reasonable bounds " + bounds);
    }
}
