package transit.sentinel.lakehouse;

public record PromotionSummary(
        PromotionResult positions,
        PromotionResult tripUpdates,
        PromotionResult weather
) {
    public int promotedTotal() {
        return positions.promoted() + tripUpdates.promoted() + weather.promoted();
    }
}
