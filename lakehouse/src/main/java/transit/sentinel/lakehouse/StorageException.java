package transit.sentinel.lakehouse;

/**
 * A layer transition failed and was rolled back. Nothing from the failed call is committed, so the
 * caller retries the same batch unchanged.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
