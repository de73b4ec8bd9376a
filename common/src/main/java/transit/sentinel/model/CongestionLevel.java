package transit.sentinel.model;

/**
 * GTFS-RT congestion levels. Each level carries the score used by the hourly rollup.
 */
public enum CongestionLevel {
    UNKNOWN_CONGESTION_LEVEL(0),
    RUNNING_SMOOTHLY(1),
    STOP_AND_GO(2),
    CONGESTION(3),
    SEVERE_CONGESTION(4);

    private final int score;

    CongestionLevel(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    public static CongestionLevel fromWireCode(int code) {
        switch (code) {
            case 1:
                return RUNNING_SMOOTHLY;
            case 2:
                return STOP_AND_GO;
            case 3:
                return CONGESTION;
            case 4:
                return SEVERE_CONGESTION;
            default:
                return UNKNOWN_CONGESTION_LEVEL;
        }
    }
}
