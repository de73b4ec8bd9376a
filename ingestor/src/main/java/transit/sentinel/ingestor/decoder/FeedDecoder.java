package transit.sentinel.ingestor.decoder;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime;
import transit.sentinel.model.CongestionLevel;
import transit.sentinel.model.OccupancyStatus;
import transit.sentinel.model.ScheduleRelationship;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.VehicleStopStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns GTFS-Realtime bytes into domain records for one agency. Decoding does not judge values; that is
 * the quality gate's job. It only resolves optional fields and maps wire codes onto closed enums.
 */
public class FeedDecoder {

    private final String agencyId;
    private final Clock clock;

    public FeedDecoder(String agencyId) {
        this(agencyId, Clock.systemUTC());
    }

    public FeedDecoder(String agencyId, Clock clock) {
        this.agencyId = Objects.requireNonNull(agencyId, "agencyId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String agencyId() {
        return agencyId;
    }

    public DecodedFeed decode(byte[] bytes) throws FeedDecodeException {
        GtfsRealtime.FeedMessage msg;
        try {
            msg = GtfsRealtime.FeedMessage.parseFrom(bytes);
        } catch (InvalidProtocolBufferException e) {
            throw new FeedDecodeException("Malformed GTFS-RT feed for " + agencyId + ": " + e.getMessage(), e);
        }

        long headerTs = msg.hasHeader() ? msg.getHeader().getTimestamp() : 0L;
        Instant feedTs = headerTs > 0 ? Instant.ofEpochSecond(headerTs) : clock.instant();

        List<VehiclePosition> positions = new ArrayList<>();
        List<TripUpdate> tripUpdates = new ArrayList<>();
        int skipped = 0;
        for (GtfsRealtime.FeedEntity ent : msg.getEntityList()) {
            boolean produced = false;
            if (ent.hasVehicle() && ent.getVehicle().hasPosition()) {
                positions.add(position(ent, ent.getVehicle(), feedTs));
                produced = true;
            }
            if (ent.hasTripUpdate()) {
                int before = tripUpdates.size();
                fanOut(ent.getTripUpdate(), feedTs, tripUpdates);
                produced |= tripUpdates.size() > before;
            }
            if (!produced) {
                skipped++;
            }
        }

        DecodeStats stats = new DecodeStats(msg.getEntityCount(), positions.size(), tripUpdates.size(), skipped);
        return new DecodedFeed(positions, tripUpdates, headerTs, feedTs, stats);
    }

    private VehiclePosition position(GtfsRealtime.FeedEntity ent, GtfsRealtime.VehiclePosition v, Instant feedTs) {
        GtfsRealtime.Position pos = v.getPosition();
        GtfsRealtime.TripDescriptor trip = v.hasTrip() ? v.getTrip() : null;

        String vehicleId = v.hasVehicle() && v.getVehicle().hasId() && !v.getVehicle().getId().isEmpty()
                ? v.getVehicle().getId()
                : ent.getId();
        Instant ts = v.hasTimestamp() && v.getTimestamp() > 0 ? Instant.ofEpochSecond(v.getTimestamp()) : feedTs;

        return new VehiclePosition(
                vehicleId,
                trip != null && trip.hasTripId() ? trip.getTripId() : null,
                trip != null && trip.hasRouteId() ? trip.getRouteId() : null,
                pos.getLatitude(),
                pos.getLongitude(),
                pos.hasBearing() ? (double) pos.getBearing() : null,
                pos.hasSpeed() ? (double) pos.getSpeed() : null,
                ts,
                feedTs,
                v.hasCurrentStopSequence() ? v.getCurrentStopSequence() : null,
                v.hasStopId() ? v.getStopId() : null,
                v.hasCurrentStatus() ? VehicleStopStatus.fromWireCode(v.getCurrentStatus().getNumber()) : null,
                v.hasCongestionLevel() ? CongestionLevel.fromWireCode(v.getCongestionLevel().getNumber()) : null,
                v.hasOccupancyStatus() ? OccupancyStatus.fromWireCode(v.getOccupancyStatus().getNumber()) : null,
                agencyId);
    }

    private void fanOut(GtfsRealtime.TripUpdate tu, Instant feedTs, List<TripUpdate> out) {
        GtfsRealtime.TripDescriptor trip = tu.getTrip();
        if (!trip.hasTripId() || trip.getTripId().isEmpty()) {
            return;
        }
        String routeId = trip.hasRouteId() ? trip.getRouteId() : null;
        String vehicleId = tu.hasVehicle() && tu.getVehicle().hasId() && !tu.getVehicle().getId().isEmpty()
                ? tu.getVehicle().getId()
                : null;
        Instant observedAt = tu.hasTimestamp() && tu.getTimestamp() > 0 ? Instant.ofEpochSecond(tu.getTimestamp()) : feedTs;

        for (GtfsRealtime.TripUpdate.StopTimeUpdate stu : tu.getStopTimeUpdateList()) {
            GtfsRealtime.TripUpdate.StopTimeEvent arrival = stu.hasArrival() ? stu.getArrival() : null;
            GtfsRealtime.TripUpdate.StopTimeEvent departure = stu.hasDeparture() ? stu.getDeparture() : null;
            out.add(new TripUpdate(
                    trip.getTripId(),
                    routeId,
                    vehicleId,
                    stu.hasStopSequence() ? stu.getStopSequence() : null,
                    stu.hasStopId() ? stu.getStopId() : null,
                    delay(arrival),
                    delay(departure),
                    time(arrival),
                    time(departure),
                    stu.hasScheduleRelationship()
                            ? ScheduleRelationship.fromWireCode(stu.getScheduleRelationship().getNumber())
                            : ScheduleRelationship.SCHEDULED,
                    agencyId,
                    observedAt));
        }
    }

    private static Integer delay(GtfsRealtime.TripUpdate.StopTimeEvent e) {
        return e != null && e.hasDelay() ? e.getDelay() : null;
    }

    private static Instant time(GtfsRealtime.TripUpdate.StopTimeEvent e) {
        return e != null && e.hasTime() ? Instant.ofEpochSecond(e.getTime()) : null;
    }
}
