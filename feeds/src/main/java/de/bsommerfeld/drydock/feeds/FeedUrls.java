package de.bsommerfeld.drydock.feeds;

/**
 * Normalization of user-entered feed URLs. Users routinely paste
 * {@code example.com/rss} without a scheme; those are fetched over HTTPS.
 */
public final class FeedUrls {

    private static final String HTTP = "http://";
    private static final String HTTPS = "https://";

    private FeedUrls() {
    }

    /**
     * Trims {@code url} and prepends {@code https://} unless it already
     * carries an HTTP(S) scheme.
     *
     * @throws FetchException if the URL is null or blank
     */
    public static String normalize(String url) throws FetchException {
        if (url == null || url.isBlank())
            throw new FetchException("Feed URL is empty");

        String trimmed = url.trim();
        if (trimmed.startsWith(HTTP) || trimmed.startsWith(HTTPS))
            return trimmed;
        return HTTPS + trimmed;
    }
}
