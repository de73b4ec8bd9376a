package transit.sentinel.lakehouse;

import java.util.List;

/**
 * Table names and DDL. All timestamps are epoch milliseconds (UTC).
 */
final class LakehouseSchema {

    static final String RAW_VEHICLE_POSITIONS = "raw_vehicle_positions";
    static final String RAW_TRIP_UPDATES = "raw_trip_updates";
    static final String RAW_WEATHER_OBSERVATIONS = "raw_weather_observations";
    static final String VALIDATED_VEHICLE_POSITIONS = "validated_vehicle_positions";
    static final String VALIDATED_TRIP_UPDATES = "validated_trip_updates";
    static final String VALIDATED_WEATHER_OBSERVATIONS = "validated_weather_observations";
    static final String AGG_VEHICLE_METRICS = "agg_vehicle_metrics";
    static final String AGG_ROUTE_PERFORMANCE = "agg_route_performance";
    static final String QUALITY_ALERTS = "quality_alerts";
    static final String LAYER_WATERMARKS = "layer_watermarks";

    static final List<String> COUNTED_TABLES = List.of(
            RAW_VEHICLE_POSITIONS, RAW_TRIP_UPDATES, RAW_WEATHER_OBSERVATIONS,
            VALIDATED_VEHICLE_POSITIONS, VALIDATED_TRIP_UPDATES, VALIDATED_WEATHER_OBSERVATIONS,
            AGG_VEHICLE_METRICS, AGG_ROUTE_PERFORMANCE, QUALITY_ALERTS);

    private static final String POSITION_COLUMNS = """
                agency_id             VARCHAR,
                vehicle_id            VARCHAR,
                trip_id               VARCHAR,
                route_id              VARCHAR,
                latitude              DOUBLE,
                longitude             DOUBLE,
                bearing               DOUBLE,
                speed                 DOUBLE,
                position_ts_ms        BIGINT,
                feed_ts_ms            BIGINT,
                current_stop_sequence INTEGER,
                stop_id               VARCHAR,
                current_status        VARCHAR,
                congestion_level      VARCHAR,
                occupancy_status      VARCHAR
            """;

    private static final String TRIP_UPDATE_COLUMNS = """
                agency_id             VARCHAR,
                trip_id               VARCHAR,
                route_id              VARCHAR,
                vehicle_id            VARCHAR,
                stop_sequence         INTEGER,
                stop_id               VARCHAR,
                arrival_delay         INTEGER,
                departure_delay       INTEGER,
                arrival_ts_ms         BIGINT,
                departure_ts_ms       BIGINT,
                schedule_relationship VARCHAR,
                ts_ms                 BIGINT
            """;

    private static final String WEATHER_COLUMNS = """
                agency_id           VARCHAR,
                latitude            DOUBLE,
                longitude           DOUBLE,
                temperature_celsius DOUBLE,
                precipitation_mm    DOUBLE,
                wind_speed_kmh      DOUBLE,
                weather_code        INTEGER,
                weather_condition   VARCHAR,
                observation_ts_ms   BIGINT
            """;

    static final List<String> DDL = List.of(
            "CREATE SEQUENCE IF NOT EXISTS raw_vehicle_positions_seq START 1",
            "CREATE SEQUENCE IF NOT EXISTS raw_trip_updates_seq START 1",
            "CREATE SEQUENCE IF NOT EXISTS raw_weather_observations_seq START 1",
            "CREATE SEQUENCE IF NOT EXISTS validated_vehicle_positions_seq START 1",
            "CREATE SEQUENCE IF NOT EXISTS validated_trip_updates_seq START 1",
            "CREATE SEQUENCE IF NOT EXISTS validated_weather_observations_seq START 1",
            rawTable(RAW_VEHICLE_POSITIONS, POSITION_COLUMNS),
            rawTable(RAW_TRIP_UPDATES, TRIP_UPDATE_COLUMNS),
            rawTable(RAW_WEATHER_OBSERVATIONS, WEATHER_COLUMNS),
            validatedTable(VALIDATED_VEHICLE_POSITIONS, POSITION_COLUMNS,
                    "agency_id, vehicle_id, position_ts_ms"),
            validatedTable(VALIDATED_TRIP_UPDATES, TRIP_UPDATE_COLUMNS,
                    "agency_id, trip_id, stop_sequence, ts_ms"),
            validatedTable(VALIDATED_WEATHER_OBSERVATIONS, WEATHER_COLUMNS,
                    "agency_id, latitude, longitude, observation_ts_ms"),
            """
            CREATE TABLE IF NOT EXISTS agg_vehicle_metrics (
                bucket_seconds       BIGINT  NOT NULL,
                bucket_start_ms      BIGINT  NOT NULL,
                agency_id            VARCHAR NOT NULL,
                route_id             VARCHAR NOT NULL,
                total_vehicles       BIGINT,
                avg_speed_kmh        DOUBLE,
                max_speed_kmh        DOUBLE,
                avg_congestion_score DOUBLE,
                total_observations   BIGINT,
                PRIMARY KEY (bucket_seconds, bucket_start_ms, agency_id, route_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS agg_route_performance (
                day_start_ms       BIGINT  NOT NULL,
                agency_id          VARCHAR NOT NULL,
                route_id           VARCHAR NOT NULL,
                avg_delay_seconds  DOUBLE,
                max_delay_seconds  INTEGER,
                min_delay_seconds  INTEGER,
                on_time_percentage DOUBLE,
                total_trips        BIGINT,
                PRIMARY KEY (day_start_ms, agency_id, route_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS quality_alerts (
                alert_id       VARCHAR PRIMARY KEY,
                alert_type     VARCHAR NOT NULL,
                severity       VARCHAR NOT NULL,
                entity_type    VARCHAR NOT NULL,
                entity_id      VARCHAR,
                agency_id      VARCHAR,
                error_message  VARCHAR NOT NULL,
                field_name     VARCHAR,
                field_value    VARCHAR,
                detected_at_ms BIGINT  NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS layer_watermarks (
                name    VARCHAR PRIMARY KEY,
                last_id BIGINT NOT NULL
            )
            """
    );

    private LakehouseSchema() {}

    private static String rawTable(String name, String columns) {
        return "CREATE TABLE IF NOT EXISTS " + name + " (\n"
                + "    raw_id         BIGINT DEFAULT nextval('" + name + "_seq') PRIMARY KEY,\n"
                + "    ingested_at_ms BIGINT NOT NULL,\n"
                + columns.stripTrailing() + "\n)";
    }

    private static String validatedTable(String name, String columns, String key) {
        return "CREATE TABLE IF NOT EXISTS " + name + " (\n"
                + "    validated_id   BIGINT NOT NULL DEFAULT nextval('" + name + "_seq'),\n"
                + "    raw_id         BIGINT NOT NULL,\n"
                + "    promoted_at_ms BIGINT NOT NULL,\n"
                + columns.stripTrailing() + ",\n"
                + "    PRIMARY KEY (" + key + ")\n)";
    }
}
