package de.bsommerfeld.drydock.feeds;

import com.google.common.base.Strings;
import com.google.common.collect.Iterables;
import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.feed.atom.Content;
import com.rometools.rome.feed.atom.Entry;
import com.rometools.rome.feed.atom.Feed;
import com.rometools.rome.feed.atom.Link;
import de.bsommerfeld.drydock.core.domain.FeedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Atom 0.3 and 1.0. Title defaults to empty; description is the summary,
 * else the first content; the date is {@code published}, else
 * {@code updated}, else {@code now}; the dedup key is the entry id, else the
 * link.
 */
public class AtomDialect implements FeedDialect {

    private static final Logger LOG = LoggerFactory.getLogger(AtomDialect.class);

    @Override
    public String name() {
        return "Atom";
    }

    @Override
    public List<FeedEntry> parse(FetchedDocument fetched, Instant now) throws FeedParseException {
        WireFeed document = RomeDocuments.read(fetched, name());
        if (!(document instanceof Feed feed))
            throw new FeedParseException("Atom parse error: document is " + document.getFeedType());

        List<FeedEntry> entries = new ArrayList<>();
        for (Entry atomEntry : feed.getEntries()) {
            FeedEntry entry = toEntry(atomEntry, now);
            if (entry != null)
                entries.add(entry);
        }
        return entries;
    }

    private FeedEntry toEntry(Entry entry, Instant now) {
        String link = firstLink(entry);
        String id = Strings.nullToEmpty(entry.getId()).trim();
        String dedupKey = id.isEmpty() ? link : id;
        if (dedupKey.isEmpty()) {
            LOG.debug("Skipping Atom entry without id and link: {}", entry.getTitle());
            return null;
        }

        Instant published = RomeDocuments.toInstant(entry.getPublished());
        if (published == null)
            published = RomeDocuments.toInstant(entry.getUpdated());

        return new FeedEntry(Strings.nullToEmpty(entry.getTitle()).trim(), link, description(entry),
                published == null ? now : published, dedupKey);
    }

    private static String firstLink(Entry entry) {
        for (Link link : Iterables.concat(entry.getAlternateLinks(), entry.getOtherLinks())) {
            String href = Strings.nullToEmpty(link.getHref()).trim();
            if (!href.isEmpty())
                return href;
        }
        return "";
    }

    private static String description(Entry entry) {
        Content summary = entry.getSummary();
        if (summary != null && summary.getValue() != null)
            return summary.getValue();
        for (Content content : entry.getContents()) {
            if (content.getValue() != null)
                return content.getValue();
        }
        return "";
    }
}
