package transit.sentinel.ingestor.fetcher;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpFeedFetcherTest {

    private static final byte[] PAYLOAD = "feed-bytes".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private String url;
    private final Deque<Integer> statuses = new ConcurrentLinkedDeque<>();
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicReference<String> ifNoneMatch = new AtomicReference<>();
    private final AtomicReference<String> accept = new AtomicReference<>();
    private volatile boolean gzip;

    private final HttpFeedFetcher fetcher = new HttpFeedFetcher();
    private final FetchProfile fast = FetchProfile.defaults().withRetry(3, Duration.ofMillis(10));

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/feed", this::handle);
        server.start();
        url = "http://localhost:" + server.getAddress().getPort() + "/feed";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        requests.incrementAndGet();
        ifNoneMatch.set(exchange.getRequestHeaders().getFirst("If-None-Match"));
        accept.set(exchange.getRequestHeaders().getFirst("Accept"));
        Integer next = statuses.poll();
        int status = next == null ? 200 : next;
        if ("\"v1\"".equals(ifNoneMatch.get())) {
            status = 304;
        }
        if (status != 200) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] body = gzip ? gzip(PAYLOAD) : PAYLOAD;
        exchange.getResponseHeaders().set("ETag", "\"v1\"");
        if (gzip) {
            exchange.getResponseHeaders().set("Content-Encoding", "gzip");
        }
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Test
    void fetchesAndSendsProfileHeaders() throws Exception {
        assertArrayEquals(PAYLOAD, fetcher.fetch(url, fast));
        assertEquals(FetchProfile.defaults().accept(), accept.get());
    }

    @Test
    void decodesGzipBodies() throws Exception {
        gzip = true;
        assertArrayEquals(PAYLOAD, fetcher.fetch(url, fast));
    }

    @Test
    void conditionalGetReturnsNullWhenUnchanged() throws Exception {
        assertArrayEquals(PAYLOAD, fetcher.fetch(url, fast));
        assertNull(fetcher.fetch(url, fast));
        assertEquals("\"v1\"", ifNoneMatch.get());
    }

    @Test
    void retriesServerErrorsThenSucceeds() throws Exception {
        statuses.add(503);
        statuses.add(500);

        assertArrayEquals(PAYLOAD, fetcher.fetch(url, fast));
        assertEquals(3, requests.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        statuses.add(503);
        statuses.add(503);
        statuses.add(503);

        FeedHttpException e = assertThrows(FeedHttpException.class, () -> fetcher.fetch(url, fast));
        assertEquals(503, e.status());
        assertEquals(3, requests.get());
    }

    @Test
    void clientErrorsAreNotRetried() {
        statuses.add(404);

        FeedHttpException e = assertThrows(FeedHttpException.class, () -> fetcher.fetch(url, fast));
        assertEquals(404, e.status());
        assertEquals(1, requests.get());
        assertFalse(e.retryable());
    }

    @Test
    void trySmartSniffsCompressionWithoutHeaders() throws Exception {
        assertArrayEquals(PAYLOAD, HttpFeedFetcher.decode(gzip(PAYLOAD), "", FetchProfile.Decompression.TRY_SMART));
        assertArrayEquals(PAYLOAD, HttpFeedFetcher.decode(deflate(PAYLOAD), "", FetchProfile.Decompression.TRY_SMART));
        assertArrayEquals(PAYLOAD, HttpFeedFetcher.decode(PAYLOAD, "", FetchProfile.Decompression.TRY_SMART));
        assertArrayEquals(PAYLOAD, HttpFeedFetcher.decode(deflate(PAYLOAD), "deflate", FetchProfile.Decompression.AUTO));
    }

    private static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(data);
        }
        return out.toByteArray();
    }

    private static byte[] deflate(byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DeflaterOutputStream def = new DeflaterOutputStream(out)) {
            def.write(data);
        }
        return out.toByteArray();
    }
}
