package de.bsommerfeld.drydock.feeds;

import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.WireFeedInput;
import com.rometools.rome.io.XmlReader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Date;

/**
 * Shared Rome plumbing for the dialects. Rome's wire-level model keeps RSS
 * channels and Atom feeds apart, which lets each dialect reject the other's
 * documents.
 *
 * <p>
 * Bytes are decoded by Rome's {@link XmlReader} in lenient mode: the encoding
 * declared in the XML prolog wins, then the {@code Content-Type} charset, then
 * the byte order mark, then UTF-8.
 */
final class RomeDocuments {

    private RomeDocuments() {
    }

    static WireFeed read(FetchedDocument document, String dialect) throws FeedParseException {
        if (document.isEmpty())
            throw new FeedParseException(dialect + " parse error: empty document");
        try (XmlReader reader = open(document)) {
            return new WireFeedInput().build(reader);
        } catch (FeedException | IOException | RuntimeException e) {
            throw new FeedParseException(dialect + " parse error: " + e.getMessage(), e);
        }
    }

    static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static XmlReader open(FetchedDocument document) throws IOException {
        InputStream in = new ByteArrayInputStream(document.body());
        return document.contentType() == null
                ? new XmlReader(in, true)
                : new XmlReader(in, document.contentType(), true);
    }
}
