package transit.sentinel.lakehouse;

/**
 * One non-empty cell of a density grid laid over a bounding box. Cell {@code (0, 0)} is the
 * south-west corner.
 */
public record HeatMapCell(
        int latCell,
        int lonCell,
        double centerLatitude,
        double centerLongitude,
        long observations,
        long vehicles
) {}
