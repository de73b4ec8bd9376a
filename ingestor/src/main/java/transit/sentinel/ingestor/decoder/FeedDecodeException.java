package transit.sentinel.ingestor.decoder;

/**
 * The feed bytes are not a GTFS-Realtime message. Fatal for the cycle: nothing from it is kept.
 */
public class FeedDecodeException extends Exception {

    public FeedDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
