package transit.sentinel.ingestor.fetcher;

import java.io.IOException;

/**
 * Non-2xx answer from the feed endpoint. Server errors and 429 are worth retrying, other client
 * errors are not.
 */
public class FeedHttpException extends IOException {
    private final int status;

    public FeedHttpException(int status, String url) {
        super("HTTP " + status + " fetching " + url);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public boolean retryable() {
        return status >= 500 || status == 429;
    }
}
