package transit.sentinel.avro;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;
import transit.sentinel.model.QualityAlert;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;

/**
 * Converts validated domain records into Avro records and their binary encoding for the event sink.
 */
public final class TransitRecords {

    private TransitRecords() {}

    public static GenericRecord toRecord(VehiclePosition p) {
        GenericRecord rec = new GenericData.Record(TransitSchemas.VEHICLE_POSITION_SCHEMA);
        rec.put("agency_id", p.agencyId());
        rec.put("vehicle_id", p.vehicleId());
        rec.put("trip_id", p.tripId());
        rec.put("route_id", p.routeId());
        rec.put("latitude", p.latitude());
        rec.put("longitude", p.longitude());
        rec.put("bearing", p.bearing());
        rec.put("speed", p.speed());
        rec.put("ts_ms", p.timestamp().toEpochMilli());
        rec.put("feed_ts_ms", p.feedTimestamp().toEpochMilli());
        rec.put("current_stop_sequence", p.currentStopSequence());
        rec.put("stop_id", p.stopId());
        rec.put("current_status", name(p.currentStatus()));
        rec.put("congestion_level", name(p.congestionLevel()));
        rec.put("occupancy_status", name(p.occupancyStatus()));
        return rec;
    }

    public static GenericRecord toRecord(TripUpdate u) {
        GenericRecord rec = new GenericData.Record(TransitSchemas.TRIP_UPDATE_SCHEMA);
        rec.put("agency_id", u.agencyId());
        rec.put("trip_id", u.tripId());
        rec.put("route_id", u.routeId());
        rec.put("vehicle_id", u.vehicleId());
        rec.put("stop_sequence", u.stopSequence());
        rec.put("stop_id", u.stopId());
        rec.put("arrival_delay", u.arrivalDelay());
        rec.put("departure_delay", u.departureDelay());
        rec.put("arrival_ts_ms", millis(u.arrivalTime()));
        rec.put("departure_ts_ms", millis(u.departureTime()));
        rec.put("schedule_relationship", u.scheduleRelationship().name());
        rec.put("ts_ms", u.timestamp().toEpochMilli());
        return rec;
    }

    public static GenericRecord toRecord(WeatherObservation w) {
        GenericRecord rec = new GenericData.Record(TransitSchemas.WEATHER_OBSERVATION_SCHEMA);
        rec.put("agency_id", w.agencyId());
        rec.put("latitude", w.latitude());
        rec.put("longitude", w.longitude());
        rec.put("temperature_celsius", w.temperatureCelsius());
        rec.put("precipitation_mm", w.precipitationMm());
        rec.put("wind_speed_kmh", w.windSpeedKmh());
        rec.put("weather_code", w.weatherCode());
        rec.put("weather_condition", w.weatherCondition().name());
        rec.put("observation_ts_ms", w.observationTime().toEpochMilli());
        return rec;
    }

    public static GenericRecord toRecord(QualityAlert a) {
        GenericRecord rec = new GenericData.Record(TransitSchemas.QUALITY_ALERT_SCHEMA);
        rec.put("alert_id", a.alertId());
        rec.put("alert_type", a.alertType().name());
        rec.put("severity", a.severity().name());
        rec.put("entity_type", a.entityType().label());
        rec.put("entity_id", a.entityId());
        rec.put("agency_id", a.agencyId());
        rec.put("error_message", a.errorMessage());
        rec.put("field_name", a.fieldName());
        rec.put("field_value", a.fieldValue());
        rec.put("detected_ts_ms", a.detectedAt().toEpochMilli());
        return rec;
    }

    public static byte[] encode(GenericRecord record) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream(256)) {
            BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
            new GenericDatumWriter<GenericRecord>(record.getSchema()).write(record, encoder);
            encoder.flush();
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Avro encode failed for " + record.getSchema().getName(), e);
        }
    }

    public static GenericRecord decode(byte[] bytes, Schema schema) {
        try {
            BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(bytes, null);
            return new GenericDatumReader<GenericRecord>(schema).read(null, decoder);
        } catch (IOException e) {
            throw new UncheckedIOException("Avro decode failed for " + schema.getName(), e);
        }
    }

    private static String name(Enum<?> e) {
        return e == null ? null : e.name();
    }

    private static Long millis(Instant ts) {
        return ts == null ? null : ts.toEpochMilli();
    }
}
