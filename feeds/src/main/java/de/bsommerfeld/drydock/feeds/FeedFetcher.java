package de.bsommerfeld.drydock.feeds;

/**
 * Retrieves the raw feed document behind a URL.
 *
 * @see HttpFeedFetcher
 */
public interface FeedFetcher {

    /**
     * @param url an absolute, already normalized HTTP(S) URL
     * @return the undecoded response body and its content type
     * @throws FetchException on transport failure, non-2xx status, a redirect
     *                        to an unusable location or too many redirects
     */
    FetchedDocument fetch(String url) throws FetchException;
}
