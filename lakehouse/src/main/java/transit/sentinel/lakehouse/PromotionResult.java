package transit.sentinel.lakehouse;

import transit.sentinel.model.EntityType;
import transit.sentinel.quality.RejectionReason;

import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of promoting one record kind. Every scanned raw row lands in exactly one bucket:
 * {@code scanned == promoted + rejectedTotal() + expired + duplicates}.
 */
public record PromotionResult(
        EntityType kind,
        int scanned,
        int promoted,
        Map<RejectionReason, Integer> rejected,
        int expired,
        int duplicates
) {
    public PromotionResult {
        rejected = rejected.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(rejected));
    }

    public static PromotionResult empty(EntityType kind) {
        return new PromotionResult(kind, 0, 0, Map.of(), 0, 0);
    }

    public int rejectedTotal() {
        return rejected.values().stream().mapToInt(Integer::intValue).sum();
    }
}
