package de.bsommerfeld.drydock.feeds;

import com.google.common.base.Strings;
import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.feed.rss.Channel;
import com.rometools.rome.feed.rss.Item;
import de.bsommerfeld.drydock.core.domain.FeedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * RSS 0.9x, 1.0 and 2.0.
 *
 * <ul>
 * <li>title defaults to {@value #DEFAULT_TITLE}</li>
 * <li>description, else {@code content:encoded}, else empty</li>
 * <li>{@code pubDate}, else {@code now}</li>
 * <li>dedup key is the {@code guid}, else the link</li>
 * </ul>
 */
public class RssDialect implements FeedDialect {

    private static final Logger LOG = LoggerFactory.getLogger(RssDialect.class);

    static final String DEFAULT_TITLE = "Untitled";

    @Override
    public String name() {
        return "RSS";
    }

    @Override
    public List<FeedEntry> parse(FetchedDocument fetched, Instant now) throws FeedParseException {
        WireFeed document = RomeDocuments.read(fetched, name());
        if (!(document instanceof Channel channel))
            throw new FeedParseException("RSS parse error: document is " + document.getFeedType());

        List<FeedEntry> entries = new ArrayList<>();
        for (Item item : channel.getItems()) {
            FeedEntry entry = toEntry(item, now);
            if (entry != null)
                entries.add(entry);
        }
        return entries;
    }

    private FeedEntry toEntry(Item item, Instant now) {
        String link = Strings.nullToEmpty(item.getLink()).trim();
        String guid = item.getGuid() == null ? "" : Strings.nullToEmpty(item.getGuid().getValue()).trim();
        String dedupKey = guid.isEmpty() ? link : guid;
        if (dedupKey.isEmpty()) {
            LOG.debug("Skipping RSS item without guid and link: {}", item.getTitle());
            return null;
        }

        String title = Strings.nullToEmpty(item.getTitle()).trim();
        if (title.isEmpty())
            title = DEFAULT_TITLE;
        Instant published = RomeDocuments.toInstant(item.getPubDate());
        return new FeedEntry(title, link, description(item), published == null ? now : published, dedupKey);
    }

    private static String description(Item item) {
        if (item.getDescription() != null && item.getDescription().getValue() != null)
            return item.getDescription().getValue();
        if (item.getContent() != null && item.getContent().getValue() != null)
            return item.getContent().getValue();
        return "";
    }
}
