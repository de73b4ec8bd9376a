package transit.sentinel.lakehouse;

import transit.sentinel.model.AlertType;

import java.util.Map;

/**
 * Point-in-time counts per table plus derived ratios.
 *
 * @param tableCounts row count keyed by table name
 * @param qualityRate validated / raw vehicle positions, 0 when nothing is raw yet
 */
public record LayerMetrics(
        Map<String, Long> tableCounts,
        double qualityRate,
        Map<AlertType, Long> alertsByType
) {
    public LayerMetrics {
        tableCounts = Map.copyOf(tableCounts);
        alertsByType = Map.copyOf(alertsByType);
    }

    public long count(String table) {
        return tableCounts.getOrDefault(table, 0L);
    }

    public long rawVehiclePositions() {
        return count(LakehouseSchema.RAW_VEHICLE_POSITIONS);
    }

    public long validatedVehiclePositions() {
        return count(LakehouseSchema.VALIDATED_VEHICLE_POSITIONS);
    }

    public long totalAlerts() {
        return alertsByType.values().stream().mapToLong(Long::longValue).sum();
    }
}
