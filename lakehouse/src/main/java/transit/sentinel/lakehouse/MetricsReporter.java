package transit.sentinel.lakehouse;

import transit.sentinel.model.AlertType;
import transit.sentinel.quality.GeoBounds;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only queries over the layer tables. Never writes; callers hold the store lock.
 */
final class MetricsReporter {

    private final Connection conn;

    MetricsReporter(Connection conn) {
        this.conn = conn;
    }

    LayerMetrics metrics() throws SQLException {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : LakehouseSchema.COUNTED_TABLES) {
            counts.put(table, count(conn, table));
        }
        long raw = counts.get(LakehouseSchema.RAW_VEHICLE_POSITIONS);
        long validated = counts.get(LakehouseSchema.VALIDATED_VEHICLE_POSITIONS);
        double qualityRate = raw == 0 ? 0.0 : (double) validated / raw;
        return new LayerMetrics(counts, qualityRate, alertsByType());
    }

    List<VehicleMetricsRow> latestVehicleMetrics(String agencyId, long bucketSeconds, int limit) throws SQLException {
        String sql = """
                SELECT bucket_seconds, bucket_start_ms, agency_id, route_id, total_vehicles, avg_speed_kmh,
                       max_speed_kmh, avg_congestion_score, total_observations
                FROM agg_vehicle_metrics
                WHERE agency_id = ? AND bucket_seconds = ?
                ORDER BY bucket_start_ms DESC, route_id
                LIMIT ?
                """;
        List<VehicleMetricsRow> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, agencyId);
            ps.setLong(2, bucketSeconds);
            ps.setInt(3, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new VehicleMetricsRow(
                            rs.getLong("bucket_seconds"),
                            Instant.ofEpochMilli(rs.getLong("bucket_start_ms")),
                            rs.getString("agency_id"),
                            rs.getString("route_id"),
                            rs.getLong("total_vehicles"),
                            Jdbc.getDouble(rs, "avg_speed_kmh"),
                            Jdbc.getDouble(rs, "max_speed_kmh"),
                            rs.getDouble("avg_congestion_score"),
                            rs.getLong("total_observations")));
                }
            }
        }
        return rows;
    }

    List<RoutePerformanceRow> routePerformance(String agencyId) throws SQLException {
        String sql = """
                SELECT day_start_ms, agency_id, route_id, avg_delay_seconds, max_delay_seconds,
                       min_delay_seconds, on_time_percentage, total_trips
                FROM agg_route_performance
                WHERE agency_id = ?
                ORDER BY day_start_ms DESC, route_id
                """;
        List<RoutePerformanceRow> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, agencyId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new RoutePerformanceRow(
                            LocalDate.ofInstant(Instant.ofEpochMilli(rs.getLong("day_start_ms")), ZoneOffset.UTC),
                            rs.getString("agency_id"),
                            rs.getString("route_id"),
                            Jdbc.getDouble(rs, "avg_delay_seconds"),
                            Jdbc.getInt(rs, "max_delay_seconds"),
                            Jdbc.getInt(rs, "min_delay_seconds"),
                            Jdbc.getDouble(rs, "on_time_percentage"),
                            rs.getLong("total_trips")));
                }
            }
        }
        return rows;
    }

    /**
     * Latest validated position per vehicle, kept when within {@code radiusMeters} (haversine) of the
     * point. Nearest first.
     */
    List<NearbyVehicle> vehiclesNear(String agencyId, double latitude, double longitude, double radiusMeters)
            throws SQLException {
        String sql = """
                WITH latest AS (
                    SELECT vehicle_id, route_id, latitude, longitude, speed, position_ts_ms
                    FROM validated_vehicle_positions
                    WHERE agency_id = ?
                    QUALIFY ROW_NUMBER() OVER (PARTITION BY vehicle_id ORDER BY position_ts_ms DESC, validated_id DESC) = 1
                ), measured AS (
                    SELECT *,
                           6371000.0 * 2 * ASIN(LEAST(1.0, SQRT(
                               POW(SIN(RADIANS(latitude - ?) / 2), 2)
                               + COS(RADIANS(?)) * COS(RADIANS(latitude)) * POW(SIN(RADIANS(longitude - ?) / 2), 2)
                           ))) AS distance_m
                    FROM latest
                )
                SELECT vehicle_id, route_id, latitude, longitude, speed, position_ts_ms, distance_m
                FROM measured
                WHERE distance_m <= ?
                ORDER BY distance_m, vehicle_id
                """;
        List<NearbyVehicle> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, agencyId);
            ps.setDouble(2, latitude);
            ps.setDouble(3, latitude);
            ps.setDouble(4, longitude);
            ps.setDouble(5, radiusMeters);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new NearbyVehicle(
                            rs.getString("vehicle_id"),
                            rs.getString("route_id"),
                            rs.getDouble("latitude"),
                            rs.getDouble("longitude"),
                            Jdbc.getDouble(rs, "speed"),
                            Instant.ofEpochMilli(rs.getLong("position_ts_ms")),
                            rs.getDouble("distance_m")));
                }
            }
        }
        return rows;
    }

    /**
     * Counts validated positions inside {@code area} per cell of a {@code gridSize x gridSize} grid.
     * Points on the north or east edge fall into the last row or column. Busiest cell first.
     */
    List<HeatMapCell> heatMap(String agencyId, GeoBounds area, int gridSize) throws SQLException {
        double latStep = (area.maxLatitude() - area.minLatitude()) / gridSize;
        double lonStep = (area.maxLongitude() - area.minLongitude()) / gridSize;
        String sql = """
                SELECT lat_cell, lon_cell, COUNT(*) AS observations, COUNT(DISTINCT vehicle_id) AS vehicles
                FROM (
                    SELECT vehicle_id,
                           LEAST(CAST(FLOOR((latitude - ?) / ?) AS INTEGER), ?) AS lat_cell,
                           LEAST(CAST(FLOOR((longitude - ?) / ?) AS INTEGER), ?) AS lon_cell
                    FROM validated_vehicle_positions
                    WHERE agency_id = ?
                      AND latitude BETWEEN ? AND ?
                      AND longitude BETWEEN ? AND ?
                ) cells
                GROUP BY lat_cell, lon_cell
                ORDER BY observations DESC, lat_cell, lon_cell
                """;
        List<HeatMapCell> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDouble(1, area.minLatitude());
            ps.setDouble(2, latStep);
            ps.setInt(3, gridSize - 1);
            ps.setDouble(4, area.minLongitude());
            ps.setDouble(5, lonStep);
            ps.setInt(6, gridSize - 1);
            ps.setString(7, agencyId);
            ps.setDouble(8, area.minLatitude());
            ps.setDouble(9, area.maxLatitude());
            ps.setDouble(10, area.minLongitude());
            ps.setDouble(11, area.maxLongitude());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int latCell = rs.getInt("lat_cell");
                    int lonCell = rs.getInt("lon_cell");
                    rows.add(new HeatMapCell(latCell, lonCell,
                            area.minLatitude() + (latCell + 0.5) * latStep,
                            area.minLongitude() + (lonCell + 0.5) * lonStep,
                            rs.getLong("observations"),
                            rs.getLong("vehicles")));
                }
            }
        }
        return rows;
    }

    /**
     * Zones (coordinates rounded to two decimals) whose average reported speed is below the threshold.
     * Positions without a speed are ignored. Slowest first.
     */
    List<SlowZone> slowZones(String agencyId, double thresholdKmh, int limit) throws SQLException {
        String sql = """
                SELECT ROUND(latitude, 2) AS lat_zone,
                       ROUND(longitude, 2) AS lon_zone,
                       AVG(speed * 3.6) AS avg_speed_kmh,
                       COUNT(*) AS observations,
                       STRING_AGG(DISTINCT route_id, ',' ORDER BY route_id) AS routes
                FROM validated_vehicle_positions
                WHERE agency_id = ? AND speed IS NOT NULL
                GROUP BY ROUND(latitude, 2), ROUND(longitude, 2)
                HAVING AVG(speed * 3.6) < ?
                ORDER BY avg_speed_kmh, lat_zone, lon_zone
                LIMIT ?
                """;
        List<SlowZone> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, agencyId);
            ps.setDouble(2, thresholdKmh);
            ps.setInt(3, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String routes = rs.getString("routes");
                    rows.add(new SlowZone(
                            rs.getDouble("lat_zone"),
                            rs.getDouble("lon_zone"),
                            rs.getDouble("avg_speed_kmh"),
                            rs.getLong("observations"),
                            routes == null || routes.isEmpty() ? List.of() : Arrays.asList(routes.split(","))));
                }
            }
        }
        return rows;
    }

    private Map<AlertType, Long> alertsByType() throws SQLException {
        Map<AlertType, Long> byType = new EnumMap<>(AlertType.class);
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT alert_type, COUNT(*) AS n FROM quality_alerts GROUP BY alert_type")) {
            while (rs.next()) {
                byType.put(AlertType.valueOf(rs.getString("alert_type")), rs.getLong("n"));
            }
        }
        return byType;
    }

    static long count(Connection conn, String table) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
