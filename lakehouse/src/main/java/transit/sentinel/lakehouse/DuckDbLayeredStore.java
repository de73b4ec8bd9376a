package transit.sentinel.lakehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transit.sentinel.model.CongestionLevel;
import transit.sentinel.model.QualityAlert;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;
import transit.sentinel.quality.GeoBounds;
import transit.sentinel.quality.QualityGate;
import transit.sentinel.quality.RejectionReason;
import transit.sentinel.quality.ValidationResult;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link LayeredStore} on one DuckDB JDBC connection. Every public call takes the store lock and runs
 * in its own transaction, so promotion and aggregation are serialized globally.
 */
public final class DuckDbLayeredStore implements LayeredStore {

    private static final Logger log = LoggerFactory.getLogger(DuckDbLayeredStore.class);

    private static final long DAY_MS = Duration.ofDays(1).toMillis();
    private static final String DELAY = "COALESCE(v.arrival_delay, v.departure_delay)";

    private final Connection conn;
    private final StoreConfig config;
    private final Clock clock;
    private final MetricsReporter reporter;
    private final LayerTable<VehiclePosition> positions;
    private final LayerTable<TripUpdate> tripUpdates;
    private final LayerTable<WeatherObservation> weather;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed;

    public static DuckDbLayeredStore open(StoreConfig config, QualityGate gate) {
        Connection conn;
        try {
            conn = DriverManager.getConnection(config.jdbcUrl());
        } catch (SQLException e) {
            throw new StorageException("Cannot open " + config.jdbcUrl(), e);
        }
        log.info("Opened layered store at {}", config.jdbcUrl());
        return new DuckDbLayeredStore(conn, gate, config, Clock.systemUTC());
    }

    public DuckDbLayeredStore(Connection conn, QualityGate gate, StoreConfig config, Clock clock) {
        this.conn = Objects.requireNonNull(conn, "conn");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(gate, "gate");
        this.reporter = new MetricsReporter(conn);
        this.positions = LayerTable.positions(gate, config.promotionWindow());
        this.tripUpdates = LayerTable.tripUpdates(gate, config.promotionWindow());
        this.weather = LayerTable.weather(gate, config.weatherPromotionWindow());
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StorageException("Cannot start transactions on " + config.jdbcUrl(), e);
        }
        initSchema();
    }

    void initSchema() {
        inTransaction("init schema", c -> {
            try (Statement st = c.createStatement()) {
                for (String ddl : LakehouseSchema.DDL) {
                    st.execute(ddl);
                }
            }
            return null;
        });
    }

    @Override
    public int appendRaw(RawBatch batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        long now = batch.ingestedAt() != null ? batch.ingestedAt().toEpochMilli() : clock.millis();
        int inserted = inTransaction("append raw", c ->
                insertRaw(c, positions, batch.positions(), now)
                        + insertRaw(c, tripUpdates, batch.tripUpdates(), now)
                        + insertRaw(c, weather, batch.weather(), now));
        log.debug("Appended {} raw rows", inserted);
        return inserted;
    }

    @Override
    public PromotionSummary promote() {
        long now = clock.millis();
        PromotionSummary summary = inTransaction("promote", c -> new PromotionSummary(
                promote(c, positions, now),
                promote(c, tripUpdates, now),
                promote(c, weather, now)));
        log.debug("Promotion: {}", summary);
        return summary;
    }

    @Override
    public int aggregateWindow(Duration bucketSize) {
        long bucketMs = bucketMillis(bucketSize);
        String sql = String.format("""
                INSERT OR REPLACE INTO agg_vehicle_metrics
                SELECT %1$d, t.bucket_start_ms, t.agency_id, t.route_id,
                       COUNT(DISTINCT v.vehicle_id),
                       AVG(v.speed * 3.6),
                       MAX(v.speed * 3.6),
                       AVG(%3$s),
                       COUNT(*)
                FROM validated_vehicle_positions v
                JOIN (SELECT DISTINCT position_ts_ms - (position_ts_ms %% %2$d) AS bucket_start_ms, agency_id, route_id
                      FROM validated_vehicle_positions
                      WHERE validated_id > ? AND validated_id <= ? AND route_id IS NOT NULL) t
                  ON v.position_ts_ms - (v.position_ts_ms %% %2$d) = t.bucket_start_ms
                 AND v.agency_id = t.agency_id
                 AND v.route_id = t.route_id
                GROUP BY t.bucket_start_ms, t.agency_id, t.route_id
                """, bucketSize.getSeconds(), bucketMs, congestionScoreSql());
        return aggregate("aggregate:vehicle_metrics:" + bucketSize.getSeconds(),
                LakehouseSchema.VALIDATED_VEHICLE_POSITIONS, sql);
    }

    @Override
    public int aggregateRoutePerformance() {
        String sql = String.format("""
                INSERT OR REPLACE INTO agg_route_performance
                SELECT t.day_start_ms, t.agency_id, t.route_id,
                       AVG(%1$s),
                       MAX(%1$s),
                       MIN(%1$s),
                       CAST(SUM(CASE WHEN %1$s BETWEEN -60 AND 300 THEN 1 ELSE 0 END) AS DOUBLE) * 100
                           / NULLIF(COUNT(%1$s), 0),
                       COUNT(DISTINCT v.trip_id)
                FROM validated_trip_updates v
                JOIN (SELECT DISTINCT ts_ms - (ts_ms %% %2$d) AS day_start_ms, agency_id, route_id
                      FROM validated_trip_updates
                      WHERE validated_id > ? AND validated_id <= ? AND route_id IS NOT NULL) t
                  ON v.ts_ms - (v.ts_ms %% %2$d) = t.day_start_ms
                 AND v.agency_id = t.agency_id
                 AND v.route_id = t.route_id
                GROUP BY t.day_start_ms, t.agency_id, t.route_id
                """, DELAY, DAY_MS);
        return aggregate("aggregate:route_performance", LakehouseSchema.VALIDATED_TRIP_UPDATES, sql);
    }

    @Override
    public int recordAlerts(List<QualityAlert> alerts) {
        if (alerts.isEmpty()) {
            return 0;
        }
        return inTransaction("record alerts", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT OR IGNORE INTO quality_alerts (alert_id, alert_type, severity, entity_type, entity_id,
                        agency_id, error_message, field_name, field_value, detected_at_ms)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                for (QualityAlert a : alerts) {
                    ps.setString(1, a.alertId());
                    ps.setString(2, a.alertType().name());
                    ps.setString(3, a.severity().name());
                    ps.setString(4, a.entityType().label());
                    Jdbc.setString(ps, 5, a.entityId());
                    Jdbc.setString(ps, 6, a.agencyId());
                    ps.setString(7, a.errorMessage());
                    Jdbc.setString(ps, 8, a.fieldName());
                    Jdbc.setString(ps, 9, a.fieldValue());
                    ps.setLong(10, a.detectedAt().toEpochMilli());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return alerts.size();
        });
    }

    @Override
    public LayerMetrics metrics() {
        return inTransaction("metrics", c -> reporter.metrics());
    }

    @Override
    public List<VehicleMetricsRow> latestVehicleMetrics(String agencyId, Duration bucketSize, int limit) {
        long seconds = bucketMillis(bucketSize) / 1000;
        return inTransaction("read vehicle metrics", c -> reporter.latestVehicleMetrics(agencyId, seconds, limit));
    }

    @Override
    public List<RoutePerformanceRow> routePerformance(String agencyId) {
        return inTransaction("read route performance", c -> reporter.routePerformance(agencyId));
    }

    @Override
    public List<NearbyVehicle> vehiclesNear(String agencyId, double latitude, double longitude, double radiusMeters) {
        if (!(radiusMeters > 0)) {
            throw new IllegalArgumentException("radiusMeters must be positive: " + radiusMeters);
        }
        return inTransaction("read nearby vehicles",
                c -> reporter.vehiclesNear(agencyId, latitude, longitude, radiusMeters));
    }

    @Override
    public List<HeatMapCell> heatMap(String agencyId, GeoBounds area, int gridSize) {
        if (gridSize <= 0) {
            throw new IllegalArgumentException("gridSize must be positive: " + gridSize);
        }
        if (area.minLatitude() == area.maxLatitude() || area.minLongitude() == area.maxLongitude()) {
            throw new IllegalArgumentException("heat map area has no extent: " + area);
        }
        return inTransaction("read heat map", c -> reporter.heatMap(agencyId, area, gridSize));
    }

    @Override
    public List<SlowZone> slowZones(String agencyId, double thresholdKmh, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return inTransaction("read slow zones", c -> reporter.slowZones(agencyId, thresholdKmh, limit));
    }

    public StoreConfig config() {
        return config;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            conn.close();
            log.info("Closed layered store at {}", config.jdbcUrl());
        } catch (SQLException e) {
            throw new StorageException("Close failed", e);
        } finally {
            lock.unlock();
        }
    }

    private <T> int insertRaw(Connection c, LayerTable<T> table, List<T> records, long ingestedAtMs)
            throws SQLException {
        if (records.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = c.prepareStatement(table.rawInsertSql())) {
            for (T record : records) {
                ps.setLong(1, ingestedAtMs);
                table.bind(ps, 2, record);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        return records.size();
    }

    private <T> PromotionResult promote(Connection c, LayerTable<T> table, long nowMs) throws SQLException {
        String mark = "promote:" + table.rawTable;
        List<RawRow<T>> rows = readRaw(c, table, watermark(c, mark));
        if (rows.isEmpty()) {
            return PromotionResult.empty(table.type);
        }

        long cutoff = nowMs - table.window.toMillis();
        Map<RejectionReason, Integer> rejected = new EnumMap<>(RejectionReason.class);
        Map<List<Object>, RawRow<T>> candidates = new LinkedHashMap<>();
        int expired = 0;
        int duplicates = 0;
        for (RawRow<T> row : rows) {
            ValidationResult<T> result = table.validate(row.record(), Instant.ofEpochMilli(row.ingestedAtMs()));
            if (!result.isAccepted()) {
                rejected.merge(result.rejection().reason(), 1, Integer::sum);
            } else if (table.timestamp(row.record()).toEpochMilli() < cutoff) {
                expired++;
            } else if (candidates.putIfAbsent(table.key(row.record()), row) != null) {
                duplicates++;
            }
        }

        long before = MetricsReporter.count(c, table.validatedTable);
        insertValidated(c, table, candidates.values(), nowMs);
        int promoted = (int) (MetricsReporter.count(c, table.validatedTable) - before);
        duplicates += candidates.size() - promoted;

        setWatermark(c, mark, rows.get(rows.size() - 1).rawId());
        return new PromotionResult(table.type, rows.size(), promoted, rejected, expired, duplicates);
    }

    private <T> List<RawRow<T>> readRaw(Connection c, LayerTable<T> table, long afterId) throws SQLException {
        List<RawRow<T>> rows = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(table.rawSelectSql())) {
            ps.setLong(1, afterId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new RawRow<>(rs.getLong("raw_id"), rs.getLong("ingested_at_ms"), table.read(rs)));
                }
            }
        }
        return rows;
    }

    private <T> void insertValidated(Connection c, LayerTable<T> table, Collection<RawRow<T>> rows, long nowMs)
            throws SQLException {
        if (rows.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = c.prepareStatement(table.validatedInsertSql())) {
            for (RawRow<T> row : rows) {
                ps.setLong(1, row.rawId());
                ps.setLong(2, nowMs);
                table.bind(ps, 3, row.record());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private int aggregate(String mark, String sourceTable, String sql) {
        return inTransaction(mark, c -> {
            long last = watermark(c, mark);
            long max = maxValidatedId(c, sourceTable);
            if (max <= last) {
                return 0;
            }
            int written;
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setLong(1, last);
                ps.setLong(2, max);
                written = ps.executeUpdate();
            }
            setWatermark(c, mark, max);
            log.debug("{}: rewrote {} aggregate rows", mark, written);
            return written;
        });
    }

    private static long watermark(Connection c, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT last_id FROM layer_watermarks WHERE name = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private static void setWatermark(Connection c, String name, long lastId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("INSERT OR REPLACE INTO layer_watermarks (name, last_id) VALUES (?, ?)")) {
            ps.setString(1, name);
            ps.setLong(2, lastId);
            ps.executeUpdate();
        }
    }

    private static long maxValidatedId(Connection c, String table) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(validated_id), 0) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static long bucketMillis(Duration bucketSize) {
        Objects.requireNonNull(bucketSize, "bucketSize");
        long ms = bucketSize.toMillis();
        if (ms < 1000 || ms % 1000 != 0) {
            throw new IllegalArgumentException("bucketSize must be a whole number of seconds: " + bucketSize);
        }
        return ms;
    }

    private static String congestionScoreSql() {
        StringBuilder sb = new StringBuilder("CASE v.congestion_level");
        for (CongestionLevel level : CongestionLevel.values()) {
            if (level.score() > 0) {
                sb.append(" WHEN '").append(level.name()).append("' THEN ").append(level.score());
            }
        }
        return sb.append(" ELSE 0 END").toString();
    }

    private <T> T inTransaction(String op, SqlWork<T> work) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Store is closed");
            }
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(e);
                log.error("{} failed, transaction rolled back", op, e);
                throw new StorageException(op + " failed", e);
            }
        } finally {
            lock.unlock();
        }
    }

    private void rollback(Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    private record RawRow<T>(long rawId, long ingestedAtMs, T record) {}
}
