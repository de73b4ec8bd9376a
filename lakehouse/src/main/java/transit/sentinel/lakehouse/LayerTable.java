package transit.sentinel.lakehouse;

import transit.sentinel.model.CongestionLevel;
import transit.sentinel.model.EntityType;
import transit.sentinel.model.OccupancyStatus;
import transit.sentinel.model.ScheduleRelationship;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.VehicleStopStatus;
import transit.sentinel.model.WeatherCondition;
import transit.sentinel.model.WeatherObservation;
import transit.sentinel.quality.QualityGate;
import transit.sentinel.quality.ValidationResult;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * How one record kind maps onto its raw and validated tables: column list, parameter binding, row
 * reading, dedup key and promotion window.
 */
abstract class LayerTable<T> {

    final EntityType type;
    final String rawTable;
    final String validatedTable;
    final String columns;
    final int columnCount;
    final Duration window;

    LayerTable(EntityType type, String rawTable, String validatedTable, String columns, Duration window) {
        this.type = type;
        this.rawTable = rawTable;
        this.validatedTable = validatedTable;
        this.columns = columns;
        this.columnCount = columns.split(",").length;
        this.window = window;
    }

    /**
     * Binds the record's columns starting at {@code idx}.
     */
    abstract void bind(PreparedStatement ps, int idx, T record) throws SQLException;

    abstract T read(ResultSet rs) throws SQLException;

    /**
     * Identity in the validated layer; only called on records that passed the gate.
     */
    abstract List<Object> key(T record);

    abstract Instant timestamp(T record);

    abstract ValidationResult<T> validate(T record, Instant now);

    String rawInsertSql() {
        return "INSERT INTO " + rawTable + " (ingested_at_ms, " + columns + ") VALUES ("
                + placeholders(columnCount + 1) + ")";
    }

    String validatedInsertSql() {
        return "INSERT OR IGNORE INTO " + validatedTable + " (raw_id, promoted_at_ms, " + columns + ") VALUES ("
                + placeholders(columnCount + 2) + ")";
    }

    String rawSelectSql() {
        return "SELECT raw_id, ingested_at_ms, " + columns + " FROM " + rawTable
                + " WHERE raw_id > ? ORDER BY raw_id";
    }

    private static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    static LayerTable<VehiclePosition> positions(QualityGate gate, Duration window) {
        return new LayerTable<>(EntityType.VEHICLE_POSITION, LakehouseSchema.RAW_VEHICLE_POSITIONS,
                LakehouseSchema.VALIDATED_VEHICLE_POSITIONS,
                "agency_id, vehicle_id, trip_id, route_id, latitude, longitude, bearing, speed, position_ts_ms, "
                        + "feed_ts_ms, current_stop_sequence, stop_id, current_status, congestion_level, occupancy_status",
                window) {
            @Override
            void bind(PreparedStatement ps, int i, VehiclePosition p) throws SQLException {
                Jdbc.setString(ps, i, p.agencyId());
                Jdbc.setString(ps, i + 1, p.vehicleId());
                Jdbc.setString(ps, i + 2, p.tripId());
                Jdbc.setString(ps, i + 3, p.routeId());
                ps.setDouble(i + 4, p.latitude());
                ps.setDouble(i + 5, p.longitude());
                Jdbc.setDouble(ps, i + 6, p.bearing());
                Jdbc.setDouble(ps, i + 7, p.speed());
                Jdbc.setMillis(ps, i + 8, p.timestamp());
                Jdbc.setMillis(ps, i + 9, p.feedTimestamp());
                Jdbc.setInt(ps, i + 10, p.currentStopSequence());
                Jdbc.setString(ps, i + 11, p.stopId());
                Jdbc.setName(ps, i + 12, p.currentStatus());
                Jdbc.setName(ps, i + 13, p.congestionLevel());
                Jdbc.setName(ps, i + 14, p.occupancyStatus());
            }

            @Override
            VehiclePosition read(ResultSet rs) throws SQLException {
                return new VehiclePosition(
                        rs.getString("vehicle_id"),
                        rs.getString("trip_id"),
                        rs.getString("route_id"),
                        orNaN(Jdbc.getDouble(rs, "latitude")),
                        orNaN(Jdbc.getDouble(rs, "longitude")),
                        Jdbc.getDouble(rs, "bearing"),
                        Jdbc.getDouble(rs, "speed"),
                        Jdbc.getMillis(rs, "position_ts_ms"),
                        Jdbc.getMillis(rs, "feed_ts_ms"),
                        Jdbc.getInt(rs, "current_stop_sequence"),
                        rs.getString("stop_id"),
                        Jdbc.getEnum(rs, "current_status", VehicleStopStatus.class, VehicleStopStatus.UNKNOWN),
                        Jdbc.getEnum(rs, "congestion_level", CongestionLevel.class, CongestionLevel.UNKNOWN_CONGESTION_LEVEL),
                        Jdbc.getEnum(rs, "occupancy_status", OccupancyStatus.class, OccupancyStatus.UNKNOWN),
                        rs.getString("agency_id"));
            }

            @Override
            List<Object> key(VehiclePosition p) {
                return List.of(p.agencyId(), p.vehicleId(), p.timestamp());
            }

            @Override
            Instant timestamp(VehiclePosition p) {
                return p.timestamp();
            }

            @Override
            ValidationResult<VehiclePosition> validate(VehiclePosition p, Instant now) {
                return gate.validate(p, now);
            }
        };
    }

    static LayerTable<TripUpdate> tripUpdates(QualityGate gate, Duration window) {
        return new LayerTable<>(EntityType.TRIP_UPDATE, LakehouseSchema.RAW_TRIP_UPDATES,
                LakehouseSchema.VALIDATED_TRIP_UPDATES,
                "agency_id, trip_id, route_id, vehicle_id, stop_sequence, stop_id, arrival_delay, departure_delay, "
                        + "arrival_ts_ms, departure_ts_ms, schedule_relationship, ts_ms",
                window) {
            @Override
            void bind(PreparedStatement ps, int i, TripUpdate u) throws SQLException {
                Jdbc.setString(ps, i, u.agencyId());
                Jdbc.setString(ps, i + 1, u.tripId());
                Jdbc.setString(ps, i + 2, u.routeId());
                Jdbc.setString(ps, i + 3, u.vehicleId());
                Jdbc.setInt(ps, i + 4, u.stopSequence());
                Jdbc.setString(ps, i + 5, u.stopId());
                Jdbc.setInt(ps, i + 6, u.arrivalDelay());
                Jdbc.setInt(ps, i + 7, u.departureDelay());
                Jdbc.setMillis(ps, i + 8, u.arrivalTime());
                Jdbc.setMillis(ps, i + 9, u.departureTime());
                Jdbc.setName(ps, i + 10, u.scheduleRelationship());
                Jdbc.setMillis(ps, i + 11, u.timestamp());
            }

            @Override
            TripUpdate read(ResultSet rs) throws SQLException {
                return new TripUpdate(
                        rs.getString("trip_id"),
                        rs.getString("route_id"),
                        rs.getString("vehicle_id"),
                        Jdbc.getInt(rs, "stop_sequence"),
                        rs.getString("stop_id"),
                        Jdbc.getInt(rs, "arrival_delay"),
                        Jdbc.getInt(rs, "departure_delay"),
                        Jdbc.getMillis(rs, "arrival_ts_ms"),
                        Jdbc.getMillis(rs, "departure_ts_ms"),
                        Jdbc.getEnum(rs, "schedule_relationship", ScheduleRelationship.class, ScheduleRelationship.UNKNOWN),
                        rs.getString("agency_id"),
                        Jdbc.getMillis(rs, "ts_ms"));
            }

            @Override
            List<Object> key(TripUpdate u) {
                return List.of(u.agencyId(), u.tripId(), u.stopSequence(), u.timestamp());
            }

            @Override
            Instant timestamp(TripUpdate u) {
                return u.timestamp();
            }

            @Override
            ValidationResult<TripUpdate> validate(TripUpdate u, Instant now) {
                return gate.validate(u, now);
            }
        };
    }

    static LayerTable<WeatherObservation> weather(QualityGate gate, Duration window) {
        return new LayerTable<>(EntityType.WEATHER_OBSERVATION, LakehouseSchema.RAW_WEATHER_OBSERVATIONS,
                LakehouseSchema.VALIDATED_WEATHER_OBSERVATIONS,
                "agency_id, latitude, longitude, temperature_celsius, precipitation_mm, wind_speed_kmh, "
                        + "weather_code, weather_condition, observation_ts_ms",
                window) {
            @Override
            void bind(PreparedStatement ps, int i, WeatherObservation w) throws SQLException {
                Jdbc.setString(ps, i, w.agencyId());
                ps.setDouble(i + 1, w.latitude());
                ps.setDouble(i + 2, w.longitude());
                ps.setDouble(i + 3, w.temperatureCelsius());
                ps.setDouble(i + 4, w.precipitationMm());
                ps.setDouble(i + 5, w.windSpeedKmh());
                ps.setInt(i + 6, w.weatherCode());
                Jdbc.setName(ps, i + 7, w.weatherCondition());
                Jdbc.setMillis(ps, i + 8, w.observationTime());
            }

            @Override
            WeatherObservation read(ResultSet rs) throws SQLException {
                return new WeatherObservation(
                        orNaN(Jdbc.getDouble(rs, "latitude")),
                        orNaN(Jdbc.getDouble(rs, "longitude")),
                        orNaN(Jdbc.getDouble(rs, "temperature_celsius")),
                        orNaN(Jdbc.getDouble(rs, "precipitation_mm")),
                        orNaN(Jdbc.getDouble(rs, "wind_speed_kmh")),
                        rs.getInt("weather_code"),
                        Jdbc.getEnum(rs, "weather_condition", WeatherCondition.class, WeatherCondition.UNKNOWN),
                        Jdbc.getMillis(rs, "observation_ts_ms"),
                        rs.getString("agency_id"));
            }

            @Override
            List<Object> key(WeatherObservation w) {
                return List.of(w.agencyId(), w.latitude(), w.longitude(), w.observationTime());
            }

            @Override
            Instant timestamp(WeatherObservation w) {
                return w.observationTime();
            }

            @Override
            ValidationResult<WeatherObservation> validate(WeatherObservation w, Instant now) {
                return gate.validate(w, now);
            }
        };
    }

    private static double orNaN(Double v) {
        return v == null ? Double.NaN : v;
    }
}
