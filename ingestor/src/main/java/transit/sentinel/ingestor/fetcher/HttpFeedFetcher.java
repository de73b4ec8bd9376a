package transit.sentinel.ingestor.fetcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Feed fetcher on {@link HttpClient}: conditional GET per url, transparent gzip/deflate, and bounded
 * exponential backoff on I/O errors and retryable HTTP statuses.
 */
public class HttpFeedFetcher implements FeedFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFeedFetcher.class);

    private final HttpClient client;
    private final ConcurrentHashMap<String, Validators> validators = new ConcurrentHashMap<>();

    public HttpFeedFetcher() {
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public byte[] fetch(String url, FetchProfile profile) throws IOException, InterruptedException {
        IOException last = null;
        for (int attempt = 1; attempt <= profile.maxAttempts(); attempt++) {
            try {
                return fetchOnce(url, profile);
            } catch (FeedHttpException e) {
                if (!e.retryable()) {
                    throw e;
                }
                last = e;
            } catch (IOException e) {
                last = e;
            }
            if (attempt < profile.maxAttempts()) {
                long sleepMs = profile.initialBackoff().toMillis() << (attempt - 1);
                log.debug("Fetch of {} failed (attempt {}/{}): {}; retrying in {} ms",
                        url, attempt, profile.maxAttempts(), last.getMessage(), sleepMs);
                Thread.sleep(sleepMs);
            }
        }
        log.warn("Giving up on {} after {} attempts", url, profile.maxAttempts());
        throw last;
    }

    private byte[] fetchOnce(String url, FetchProfile profile) throws IOException, InterruptedException {
        HttpRequest.Builder rb = HttpRequest.newBuilder(URI.create(url))
                .GET()
                .timeout(profile.timeout())
                .header("User-Agent", profile.userAgent());

        if (profile.accept() != null && !profile.accept().isBlank()) rb.header("Accept", profile.accept());
        if (profile.acceptEncoding() != null && !profile.acceptEncoding().isBlank()) rb.header("Accept-Encoding", profile.acceptEncoding());
        for (Map.Entry<String, String> h : profile.headers().entrySet()) rb.header(h.getKey(), h.getValue());

        if (profile.conditionalGet()) {
            Validators v = validators.get(url);
            if (v != null) {
                if (v.etag() != null) rb.header("If-None-Match", v.etag());
                if (v.lastModified() != null) rb.header("If-Modified-Since", v.lastModified());
            }
        }

        HttpResponse<byte[]> resp = client.send(rb.build(), HttpResponse.BodyHandlers.ofByteArray());
        int sc = resp.statusCode();
        if (sc == 304) {
            log.debug("{} not modified", url);
            return null;
        }
        if (sc != 200) throw new FeedHttpException(sc, url);

        if (profile.conditionalGet()) {
            validators.put(url, new Validators(first(resp, "ETag"), first(resp, "Last-Modified")));
        }
        return decode(resp.body(), contentEncoding(resp), profile.decompression());
    }

    private static String first(HttpResponse<?> r, String name) {
        return r.headers().firstValue(name).orElse(null);
    }

    private static String contentEncoding(HttpResponse<?> r) {
        String v = first(r, "Content-Encoding");
        return v == null ? "" : v.trim().toLowerCase(Locale.ROOT);
    }

    static byte[] decode(byte[] body, String contentEnc, FetchProfile.Decompression mode) throws IOException {
        switch (mode) {
            case NONE:
                return body;
            case GZIP:
                return gunzip(body);
            case DEFLATE:
                return inflateEither(body);
            case TRY_SMART:
                if (body.length >= 2 && (body[0] == 0x1F && (body[1] & 0xFF) == 0x8B)) return gunzip(body);
                if (body.length >= 2 && (body[0] == 0x78)) return inflateEither(body);
                return body;
            case AUTO:
            default:
                if (contentEnc == null || contentEnc.isEmpty() || "identity".equals(contentEnc)) return body;
                if ("gzip".equals(contentEnc) || "x-gzip".equals(contentEnc)) return gunzip(body);
                if ("deflate".equals(contentEnc)) return inflateEither(body);
                return body;
        }
    }

    private static byte[] gunzip(byte[] data) throws IOException {
        try (GZIPInputStream gis = new GZIPInputStream(new ByteArrayInputStream(data));
             ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(1024, data.length))) {
            gis.transferTo(out);
            return out.toByteArray();
        }
    }

    // zlib-wrapped first, raw deflate as fallback
    private static byte[] inflateEither(byte[] data) throws IOException {
        try {
            return inflate(data, false);
        } catch (IOException e) {
            return inflate(data, true);
        }
    }

    private static byte[] inflate(byte[] data, boolean raw) throws IOException {
        Inflater inf = new Inflater(raw);
        try (InflaterInputStream iis = new InflaterInputStream(new ByteArrayInputStream(data), inf);
             ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(1024, data.length))) {
            iis.transferTo(out);
            return out.toByteArray();
        } finally {
            inf.end();
        }
    }

    private record Validators(String etag, String lastModified) {
    }
}
