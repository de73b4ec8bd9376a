package transit.sentinel.model;

/**
 * Stop-time schedule relationship. {@link #UNKNOWN} is only produced for wire codes outside the
 * GTFS-RT set and never passes the quality gate.
 */
public enum ScheduleRelationship {
    SCHEDULED,
    SKIPPED,
    NO_DATA,
    UNSCHEDULED,
    UNKNOWN;

    public static ScheduleRelationship fromWireCode(int code) {
        switch (code) {
            case 0:
                return SCHEDULED;
            case 1:
                return SKIPPED;
            case 2:
                return NO_DATA;
            case 3:
                return UNSCHEDULED;
            default:
                return UNKNOWN;
        }
    }
}
