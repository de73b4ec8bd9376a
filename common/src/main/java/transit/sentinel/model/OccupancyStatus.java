package transit.sentinel.model;

public enum OccupancyStatus {
    EMPTY,
    MANY_SEATS_AVAILABLE,
    FEW_SEATS_AVAILABLE,
    STANDING_ROOM_ONLY,
    CRUSHED_STANDING_ROOM_ONLY,
    FULL,
    NOT_ACCEPTING_PASSENGERS,
    UNKNOWN;

    public static OccupancyStatus fromWireCode(int code) {
        switch (code) {
            case 0:
                return EMPTY;
            case 1:
                return MANY_SEATS_AVAILABLE;
            case 2:
                return FEW_SEATS_AVAILABLE;
            case 3:
                return STANDING_ROOM_ONLY;
            case 4:
                return CRUSHED_STANDING_ROOM_ONLY;
            case 5:
                return FULL;
            case 6:
                return NOT_ACCEPTING_PASSENGERS;
            default:
                return UNKNOWN;
        }
    }
}
