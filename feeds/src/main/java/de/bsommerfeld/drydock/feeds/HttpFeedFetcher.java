package de.bsommerfeld.drydock.feeds;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.config.DryDockConfig;
import de.bsommerfeld.drydock.core.config.SyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link FeedFetcher} on top of {@link HttpClient}.
 *
 * <h3>Redirect handling</h3>
 * The client never follows redirects on its own. Each 3xx response with a
 * {@code Location} header is followed manually so the chain length can be
 * capped at {@code max-redirects}; relative locations are resolved against
 * the current URL. Every hop must stay on {@code http} or {@code https}.
 *
 * <h3>Body</h3>
 * The body is returned as raw bytes together with the {@code Content-Type}
 * header. Decoding is left to the XML reader.
 *
 * <h3>User-Agent</h3>
 * Several publishers reject requests without a browser-like User-Agent, so
 * every request carries the configured one.
 */
@Singleton
public class HttpFeedFetcher implements FeedFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFeedFetcher.class);

    private final HttpClient client;
    private final Duration timeout;
    private final int maxRedirects;
    private final String userAgent;

    @Inject
    public HttpFeedFetcher(DryDockConfig config) {
        this(Duration.ofSeconds(config.getSync().getHttpTimeoutSeconds()),
                config.getSync().getMaxRedirects(),
                config.getSync().getUserAgent());
    }

    public HttpFeedFetcher(Duration timeout, int maxRedirects, String userAgent) {
        this.timeout = timeout;
        this.maxRedirects = maxRedirects;
        this.userAgent = userAgent == null || userAgent.isBlank() ? SyncConfig.DEFAULT_USER_AGENT : userAgent;
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public FetchedDocument fetch(String url) throws FetchException {
        URI current = toUri(url);
        for (int redirects = 0;; redirects++) {
            HttpResponse<byte[]> response = send(current);
            int status = response.statusCode();

            if (isRedirect(status)) {
                Optional<String> location = response.headers().firstValue("Location");
                if (location.isEmpty())
                    throw new FetchException("HTTP " + status + " without Location header for URL: " + current);
                if (redirects >= maxRedirects)
                    throw new FetchException("Too many redirects (> " + maxRedirects + ") for URL: " + url);
                URI next = resolveRedirect(current, location.get().trim());
                LOG.debug("Following redirect {} -> {}", current, next);
                current = next;
                continue;
            }

            validateStatus(status, current);
            return new FetchedDocument(response.body(), response.headers().firstValue("Content-Type").orElse(null));
        }
    }

    private HttpResponse<byte[]> send(URI uri) throws FetchException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException("Cannot request '" + uri + "': " + e.getMessage(), e);
        }
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchException("Timed out after " + timeout.toSeconds() + "s fetching '" + uri + "'", e);
        } catch (IOException e) {
            throw new FetchException("Failed to fetch feed from '" + uri + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Fetch interrupted: " + uri, e);
        }
    }

    private static URI toUri(String url) throws FetchException {
        try {
            return requireHttp(URI.create(url), url);
        } catch (IllegalArgumentException e) {
            throw new FetchException("Malformed feed URL: " + url, e);
        }
    }

    private static URI resolveRedirect(URI current, String location) throws FetchException {
        try {
            return requireHttp(current.resolve(location), location);
        } catch (IllegalArgumentException e) {
            throw new FetchException("Malformed redirect location '" + location + "' from " + current, e);
        }
    }

    private static URI requireHttp(URI uri, String original) throws FetchException {
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))
            throw new FetchException("Unsupported URL scheme '" + scheme + "': " + original);
        if (uri.getHost() == null)
            throw new FetchException("Feed URL has no host: " + original);
        return uri;
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static void validateStatus(int status, URI uri) throws FetchException {
        if (status < 200 || status >= 300) {
            throw new FetchException("HTTP error: " + status + " for URL: " + uri);
        }
    }
}
