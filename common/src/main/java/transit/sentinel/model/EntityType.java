package transit.sentinel.model;

public enum EntityType {
    VEHICLE_POSITION("vehicle_position"),
    TRIP_UPDATE("trip_update"),
    WEATHER_OBSERVATION("weather_observation");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
