package de.bsommerfeld.drydock.feeds;

import de.bsommerfeld.drydock.core.domain.FeedEntry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the RSS-then-Atom parsing chain and entry normalization against the
 * fixtures under {@code src/test/resources/feeds}.
 */
class FeedParserTest {

    private static final Instant NOW = Instant.parse("2026-03-05T12:00:00Z");

    private final FeedParser parser = new FeedParser();

    // -- RSS --

    @Test
    void parse_rss_shouldUseGuidAsDedupKey() throws Exception {
        FeedEntry first = parser.parse(fixture("rss2.xml"), NOW).get(0);

        assertEquals("Crane maintenance", first.title());
        assertEquals("https://harbour.example/posts/crane", first.link());
        assertEquals("Crane 4 is down until Friday.", first.description());
        assertEquals(Instant.parse("2026-03-02T10:00:00Z"), first.publishedAt());
        assertEquals("harbour-post-1", first.dedupKey());
    }

    @Test
    void parse_rss_withoutGuid_shouldFallBackToLink() throws Exception {
        FeedEntry second = parser.parse(fixture("rss2.xml"), NOW).get(1);

        assertEquals("https://harbour.example/posts/berth", second.dedupKey());
    }

    @Test
    void parse_rss_withoutDescription_shouldUseEncodedContent() throws Exception {
        FeedEntry second = parser.parse(fixture("rss2.xml"), NOW).get(1);

        assertEquals("Berth 7 accepts vessels from today.", second.description().trim());
    }

    @Test
    void parse_rss_withoutPubDate_shouldDefaultToNow() throws Exception {
        FeedEntry second = parser.parse(fixture("rss2.xml"), NOW).get(1);

        assertEquals(NOW, second.publishedAt());
    }

    @Test
    void parse_rss_withoutTitle_shouldDefaultToUntitled() throws Exception {
        FeedEntry third = parser.parse(fixture("rss2.xml"), NOW).get(2);

        assertEquals("Untitled", third.title());
        assertEquals("harbour-post-3", third.dedupKey());
    }

    @Test
    void parse_rss_shouldSkipItemsWithoutIdentity() throws Exception {
        String rss = "<rss version=\"2.0\"><channel><title>t</title><link>https://x.example</link>"
                + "<description>d</description>"
                + "<item><title>anonymous</title></item>"
                + "<item><title>kept</title><guid>k-1</guid></item>"
                + "</channel></rss>";

        List<FeedEntry> entries = parser.parse(xml(rss), NOW);

        assertEquals(1, entries.size());
        assertEquals("k-1", entries.get(0).dedupKey());
        assertEquals("", entries.get(0).link());
    }

    @Test
    void parse_emptyChannel_shouldReturnNoEntries() throws Exception {
        String rss = "<rss version=\"2.0\"><channel><title>t</title><link>https://x.example</link>"
                + "<description>d</description></channel></rss>";

        assertTrue(parser.parse(xml(rss), NOW).isEmpty());
    }

    // -- Encoding --

    @Test
    void parse_latin1Document_shouldHonourPrologEncoding() throws Exception {
        FetchedDocument latin1 = new FetchedDocument(fixture("rss-latin1.xml").body(), "application/rss+xml");

        FeedEntry entry = parser.parse(latin1, NOW).get(0);

        assertEquals("Caf\u00e9 am Kai", entry.title());
        assertEquals("Gr\u00fc\u00dfe vom Hafen", entry.description());
    }

    @Test
    void parse_latin1Document_withoutContentType_shouldHonourPrologEncoding() throws Exception {
        FeedEntry entry = parser.parse(fixture("rss-latin1.xml"), NOW).get(0);

        assertEquals("Caf\u00e9 am Kai", entry.title());
    }

    @Test
    void parse_utf8WithByteOrderMark_shouldParse() throws Exception {
        byte[] rss = ("\uFEFF<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<rss version=\"2.0\"><channel><title>t</title><link>https://x.example</link>"
                + "<description>d</description><item><title>\u00d6lwechsel</title><guid>o-1</guid></item>"
                + "</channel></rss>").getBytes(StandardCharsets.UTF_8);

        FeedEntry entry = parser.parse(new FetchedDocument(rss, "text/xml; charset=UTF-8"), NOW).get(0);

        assertEquals("\u00d6lwechsel", entry.title());
    }

    // -- Atom --

    @Test
    void parse_atom_shouldFallBackFromRss() throws Exception {
        List<FeedEntry> entries = parser.parse(fixture("atom.xml"), NOW);

        assertEquals(2, entries.size());
        FeedEntry first = entries.get(0);
        assertEquals("Hull inspection", first.title());
        assertEquals("https://shipyard.example/hull", first.link());
        assertEquals("Inspection passed.", first.description());
        assertEquals("urn:uuid:entry-1", first.dedupKey());
    }

    @Test
    void parse_atom_shouldPreferPublishedOverUpdated() throws Exception {
        FeedEntry first = parser.parse(fixture("atom.xml"), NOW).get(0);

        assertEquals(Instant.parse("2026-03-01T08:30:00Z"), first.publishedAt());
    }

    @Test
    void parse_atom_withoutPublished_shouldUseUpdatedAndContent() throws Exception {
        FeedEntry second = parser.parse(fixture("atom.xml"), NOW).get(1);

        assertEquals(Instant.parse("2026-03-03T09:00:00Z"), second.publishedAt());
        assertEquals("Second coat next week.", second.description());
        assertEquals("https://shipyard.example/paint", second.link());
    }

    // -- Dialect order & failures --

    @Test
    void rssDialect_shouldRejectAtomDocument() {
        assertThrows(FeedParseException.class, () -> new RssDialect().parse(fixture("atom.xml"), NOW));
    }

    @Test
    void atomDialect_shouldRejectRssDocument() {
        assertThrows(FeedParseException.class, () -> new AtomDialect().parse(fixture("rss2.xml"), NOW));
    }

    @Test
    void parse_html_shouldFailWithParseException() {
        FeedParseException ex = assertThrows(FeedParseException.class,
                () -> parser.parse(fixture("not-a-feed.html"), NOW));

        assertEquals("Failed to parse feed as RSS or Atom", ex.getMessage());
        assertInstanceOf(FeedParseException.class, ex.getCause());
        assertEquals(1, ex.getSuppressed().length);
    }

    @Test
    void parse_garbage_shouldFailWithParseException() {
        assertThrows(FeedParseException.class, () -> parser.parse(xml("definitely { not xml"), NOW));
    }

    @Test
    void parse_emptyBody_shouldFailWithParseException() {
        assertThrows(FeedParseException.class, () -> parser.parse(xml(""), NOW));
    }

    @Test
    void parse_shouldStopAtFirstAcceptingDialect() throws Exception {
        FeedDialect accepting = new FeedDialect() {
            @Override
            public String name() {
                return "first";
            }

            @Override
            public List<FeedEntry> parse(FetchedDocument document, Instant now) {
                return List.of(new FeedEntry("t", "", "", now, "k"));
            }
        };
        FeedDialect failing = new FeedDialect() {
            @Override
            public String name() {
                return "second";
            }

            @Override
            public List<FeedEntry> parse(FetchedDocument document, Instant now) {
                throw new AssertionError("second dialect must not be consulted");
            }
        };

        List<FeedEntry> entries = new FeedParser(List.of(accepting, failing)).parse(xml("anything"), NOW);

        assertEquals(1, entries.size());
    }

    static FetchedDocument fixture(String name) throws IOException {
        try (InputStream in = FeedParserTest.class.getClassLoader().getResourceAsStream("feeds/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new FetchedDocument(in.readAllBytes(), null);
        }
    }

    static FetchedDocument xml(String body) {
        return new FetchedDocument(body.getBytes(StandardCharsets.UTF_8), "application/xml");
    }
}
