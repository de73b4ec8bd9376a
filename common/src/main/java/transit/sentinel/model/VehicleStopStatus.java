package transit.sentinel.model;

public enum VehicleStopStatus {
    INCOMING_AT,
    STOPPED_AT,
    IN_TRANSIT_TO,
    UNKNOWN;

    public static VehicleStopStatus fromWireCode(int code) {
        switch (code) {
            case 0:
                return INCOMING_AT;
            case 1:
                return STOPPED_AT;
            case 2:
                return IN_TRANSIT_TO;
            default:
                return UNKNOWN;
        }
    }
}
