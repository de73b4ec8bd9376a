package transit.sentinel.lakehouse;

import transit.sentinel.model.QualityAlert;
import transit.sentinel.quality.GeoBounds;

import java.time.Duration;
import java.util.List;

/**
 * Raw, validated and aggregate layers plus the transitions between them. Every write call is
 * all-or-nothing; on failure it throws {@link StorageException} with nothing committed.
 */
public interface LayeredStore extends AutoCloseable {

    /**
     * Appends every record unconditionally; raw rows are never updated or deleted.
     *
     * @return number of raw rows inserted
     */
    int appendRaw(RawBatch batch);

    /**
     * Moves raw rows not yet scanned into the validated layer: re-checks them against the quality
     * gate, drops those outside the promotion window and skips any already validated.
     */
    PromotionSummary promote();

    /**
     * Recomputes vehicle metrics for every bucket of the given size touched by validated rows since
     * the previous call with the same size.
     *
     * @return aggregate rows written
     */
    int aggregateWindow(Duration bucketSize);

    /**
     * Recomputes daily route delay rollups touched by validated trip updates since the last call.
     *
     * @return aggregate rows written
     */
    int aggregateRoutePerformance();

    int recordAlerts(List<QualityAlert> alerts);

    LayerMetrics metrics();

    List<VehicleMetricsRow> latestVehicleMetrics(String agencyId, Duration bucketSize, int limit);

    List<RoutePerformanceRow> routePerformance(String agencyId);

    /**
     * Vehicles whose latest validated position lies within {@code radiusMeters} of the point, nearest first.
     */
    List<NearbyVehicle> vehiclesNear(String agencyId, double latitude, double longitude, double radiusMeters);

    /**
     * Validated position density over {@code area} split into {@code gridSize x gridSize} cells. Empty
     * cells are omitted.
     */
    List<HeatMapCell> heatMap(String agencyId, GeoBounds area, int gridSize);

    /**
     * Up to {@code limit} zones whose average validated speed is below {@code thresholdKmh}, slowest first.
     */
    List<SlowZone> slowZones(String agencyId, double thresholdKmh, int limit);

    @Override
    void close();
}
