package de.bsommerfeld.drydock.feeds;

import java.util.Objects;

/**
 * Raw feed document as it came off the wire. The bytes stay undecoded so the
 * XML reader can pick the charset from the {@code Content-Type} header, the
 * byte order mark or the XML prolog.
 *
 * @param contentType the response's {@code Content-Type}, or {@code null} if
 *                    the server sent none
 */
public record FetchedDocument(byte[] body, String contentType) {

    public FetchedDocument {
        Objects.requireNonNull(body, "body");
    }

    public boolean isEmpty() {
        return body.length == 0;
    }
}
