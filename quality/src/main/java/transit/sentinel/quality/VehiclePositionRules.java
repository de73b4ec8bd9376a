package transit.sentinel.quality;

import transit.sentinel.model.VehiclePosition;

import java.util.List;
import java.util.Locale;

/**
 * Ordered rule list for vehicle positions. Order matters: the first failing rule is the reported reason.
 */
public final class VehiclePositionRules {

    private VehiclePositionRules() {}

    public static List<QualityRule<VehiclePosition>> build(QualityConfig cfg) {
        return List.of(
                QualityRule.of("required-fields", (rule, p, now) -> {
                    if (Checks.blank(p.vehicleId())) return Checks.missing(rule, "vehicle_id");
                    if (Checks.blank(p.agencyId())) return Checks.missing(rule, "agency_id");
                    if (p.timestamp() == null) return Checks.missing(rule, "timestamp");
                    if (p.feedTimestamp() == null) return Checks.missing(rule, "feed_timestamp");
                    if (!Double.isFinite(p.latitude())) return Checks.missing(rule, "latitude");
                    if (!Double.isFinite(p.longitude())) return Checks.missing(rule, "longitude");
                    return null;
                }),
                QualityRule.of("coordinate-range", (rule, p, now) -> {
                    if (p.latitude() < -90.0 || p.latitude() > 90.0) {
                        return Checks.outOfRange(rule, "latitude", p.latitude(), "[-90, 90]");
                    }
                    if (p.longitude() < -180.0 || p.longitude() > 180.0) {
                        return Checks.outOfRange(rule, "longitude", p.longitude(), "[-180, 180]");
                    }
                    return null;
                }),
                QualityRule.of("bearing-range", (rule, p, now) -> {
                    Double b = p.bearing();
                    if (b != null && (!Double.isFinite(b) || b < 0.0 || b >= 360.0)) {
                        return Checks.outOfRange(rule, "bearing", b, "[0, 360)");
                    }
                    return null;
                }),
                QualityRule.of("speed-non-negative", (rule, p, now) -> {
                    Double s = p.speed();
                    if (s != null && (Double.isNaN(s) || s < 0.0)) {
                        return Checks.outOfRange(rule, "speed", s, "[0, +inf)");
                    }
                    return null;
                }),
                QualityRule.of("speed-ceiling", (rule, p, now) -> {
                    Double s = p.speed();
                    if (s != null && s > cfg.maxSpeedMps()) {
                        return new Rejection(RejectionReason.SPEED_VIOLATION, rule, "speed", Checks.render(s),
                                String.format(Locale.ROOT, "Speed %.2f m/s (%.2f km/h) exceeds maximum realistic speed %.1f m/s",
                                        s, s * 3.6, cfg.maxSpeedMps()));
                    }
                    return null;
                }),
                QualityRule.of("stop-sequence-range", (rule, p, now) -> {
                    Integer seq = p.currentStopSequence();
                    if (seq != null && seq < 0) {
                        return Checks.outOfRange(rule, "current_stop_sequence", seq, "[0, +inf)");
                    }
                    return null;
                }),
                QualityRule.of("position-freshness", (rule, p, now) ->
                        Checks.freshness(rule, "timestamp", p.timestamp(), now, cfg.maxPositionAge())),
                QualityRule.of("agency-bounds", (rule, p, now) -> {
                    GeoBounds bounds = cfg.boundsFor(p.agencyId());
                    if (!bounds.contains(p.latitude(), p.longitude())) {
                        return new Rejection(RejectionReason.GEOGRAPHIC_VIOLATION, rule, "latitude,longitude",
                                Checks.render(p.latitude()) + "," + Checks.render(p.longitude()),
                                "Position outside service area " + bounds + " of agency " + p.agencyId());
                    }
                    return null;
                })
        );
    }
}
