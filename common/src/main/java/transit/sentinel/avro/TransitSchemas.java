package transit.sentinel.avro;

import org.apache.avro.Schema;

public final class TransitSchemas {

    private TransitSchemas() {}

    private static final String VEHICLE_POSITION_SCHEMA_JSON = """
            {
              "type": "record",
              "name": "VehiclePosition",
              "namespace": "transit.sentinel.avro",
              "fields": [
                { "name": "agency_id",             "type": "string" },
                { "name": "vehicle_id",            "type": "string" },
                { "name": "trip_id",               "type": ["null", "string"], "default": null },
                { "name": "route_id",              "type": ["null", "string"], "default": null },
                { "name": "latitude",              "type": "double" },
                { "name": "longitude",             "type": "double" },
                { "name": "bearing",               "type": ["null", "double"], "default": null },
                { "name": "speed",                 "type": ["null", "double"], "default": null },
                { "name": "ts_ms",                 "type": "long" },
                { "name": "feed_ts_ms",            "type": "long" },
                { "name": "current_stop_sequence", "type": ["null", "int"], "default": null },
                { "name": "stop_id",               "type": ["null", "string"], "default": null },
                { "name": "current_status",        "type": ["null", "string"], "default": null },
                { "name": "congestion_level",      "type": ["null", "string"], "default": null },
                { "name": "occupancy_status",      "type": ["null", "string"], "default": null }
              ]
            }
            """;

    private static final String TRIP_UPDATE_SCHEMA_JSON = """
            {
              "type": "record",
              "name": "TripUpdate",
              "namespace": "transit.sentinel.avro",
              "fields": [
                { "name": "agency_id",             "type": "string" },
                { "name": "trip_id",               "type": "string" },
                { "name": "route_id",              "type": ["null", "string"], "default": null },
                { "name": "vehicle_id",            "type": ["null", "string"], "default": null },
                { "name": "stop_sequence",         "type": "int" },
                { "name": "stop_id",               "type": "string" },
                { "name": "arrival_delay",         "type": ["null", "int"], "default": null },
                { "name": "departure_delay",       "type": ["null", "int"], "default": null },
                { "name": "arrival_ts_ms",         "type": ["null", "long"], "default": null },
                { "name": "departure_ts_ms",       "type": ["null", "long"], "default": null },
                { "name": "schedule_relationship", "type": "string" },
                { "name": "ts_ms",                 "type": "long" }
              ]
            }
            """;

    private static final String WEATHER_OBSERVATION_SCHEMA_JSON = """
            {
              "type": "record",
              "name": "WeatherObservation",
              "namespace": "transit.sentinel.avro",
              "fields": [
                { "name": "agency_id",           "type": "string" },
                { "name": "latitude",            "type": "double" },
                { "name": "longitude",           "type": "double" },
                { "name": "temperature_celsius", "type": "double" },
                { "name": "precipitation_mm",    "type": "double" },
                { "name": "wind_speed_kmh",      "type": "double" },
                { "name": "weather_code",        "type": "int" },
                { "name": "weather_condition",   "type": "string" },
                { "name": "observation_ts_ms",   "type": "long" }
              ]
            }
            """;

    private static final String QUALITY_ALERT_SCHEMA_JSON = """
            {
              "type": "record",
              "name": "QualityAlert",
              "namespace": "transit.sentinel.avro",
              "fields": [
                { "name": "alert_id",       "type": "string" },
                { "name": "alert_type",     "type": "string" },
                { "name": "severity",       "type": "string" },
                { "name": "entity_type",    "type": "string" },
                { "name": "entity_id",      "type": ["null", "string"], "default": null },
                { "name": "agency_id",      "type": ["null", "string"], "default": null },
                { "name": "error_message",  "type": "string" },
                { "name": "field_name",     "type": ["null", "string"], "default": null },
                { "name": "field_value",    "type": ["null", "string"], "default": null },
                { "name": "detected_ts_ms", "type": "long" }
              ]
            }
            """;

    public static final Schema VEHICLE_POSITION_SCHEMA = new Schema.Parser().parse(VEHICLE_POSITION_SCHEMA_JSON);
    public static final Schema TRIP_UPDATE_SCHEMA = new Schema.Parser().parse(TRIP_UPDATE_SCHEMA_JSON);
    public static final Schema WEATHER_OBSERVATION_SCHEMA = new Schema.Parser().parse(WEATHER_OBSERVATION_SCHEMA_JSON);
    public static final Schema QUALITY_ALERT_SCHEMA = new Schema.Parser().parse(QUALITY_ALERT_SCHEMA_JSON);
}
