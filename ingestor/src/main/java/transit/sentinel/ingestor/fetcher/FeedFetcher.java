package transit.sentinel.ingestor.fetcher;

import java.io.IOException;

public interface FeedFetcher {
    /**
     * @return the feed body, or {@code null} when a conditional GET reports it unchanged
     */
    byte[] fetch(String url, FetchProfile profile) throws IOException, InterruptedException;
}
