package com.delta.feedscout.feed.probe;

import com.delta.feedscout.config.FeedScoutProperties;
import com.delta.feedscout.feed.http.FeedHttpClient;
import com.delta.feedscout.feed.model.FetchOutcome;
import com.delta.feedscout.feed.model.ProbeFailureReason;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupFeedProberTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private MockWebServer server;
    private ExecutorService executor;
    private JsoupFeedProber prober;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        FeedScoutProperties properties = new FeedScoutProperties();
        properties.setRequestTimeoutSeconds(2);
        executor = Executors.newFixedThreadPool(2);
        prober = new JsoupFeedProber(new FeedHttpClient(properties, executor), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void extractsTitlesFromSimpleRssFeed() {
        enqueueFeed("application/rss+xml", """
            <rss><channel>
                <item><title>Title 1</title></item>
                <item><title>Title 2</title></item>
            </channel></rss>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.url()).isEqualTo(url());
        assertThat(outcome.titles()).containsExactly("Title 1", "Title 2");
    }

    @Test
    void cleansMessyTitlesAndSkipsEmptyEntries() {
        enqueueFeed("application/rss+xml", """

            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0"
                xmlns:dc="http://purl.org/dc/elements/1.1/"
                xmlns:content="http://purl.org/rss/1.0/modules/content/">
                <channel>
                    <item>
                        <title><![CDATA[Climate & Change: New Findings]]></title>
                        <dc:creator>John Doe</dc:creator>
                        <content:encoded><![CDATA[<p>Complex <b>HTML</b> content</p>]]></content:encoded>
                    </item>
                    <item>
                        <title>Tech Update â\u0080\u0094 AI + Humanity?</title>
                    </item>
                    <item>
                        <title>💰 Economic Outlook 2025</title>
                    </item>
                    <item>
                        <title></title>  <!-- Empty title -->
                    </item>
                </channel>
            </rss>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.titles()).containsExactly(
            "Climate & Change: New Findings",
            "Tech Update — AI + Humanity?",
            "Economic Outlook 2025"
        );
    }

    @Test
    void readsAtomEntriesAndStripsEscapedMarkup() {
        enqueueFeed("application/atom+xml", """
            <?xml version="1.0" encoding="utf-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Site title is not an entry</title>
              <entry><title type="html">&lt;b&gt;Bold&lt;/b&gt; central bank move</title></entry>
              <entry><title>Second Atom headline</title></entry>
            </feed>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.titles()).containsExactly("Bold central bank move", "Second Atom headline");
    }

    @Test
    void readsRdfItems() {
        enqueueFeed("text/xml", """
            <rdf:RDF xmlns:rdf="http://www.w3.org/1999/02/22-rdf-syntax-ns#" xmlns="http://purl.org/rss/1.0/">
              <channel><title>Channel</title></channel>
              <item><title>RDF headline number one</title></item>
            </rdf:RDF>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.titles()).containsExactly("RDF headline number one");
    }

    @Test
    void blankTitlesDoNotCountTowardTheLimit() {
        enqueueFeed("application/rss+xml", """
            <rss><channel>
                <item><title></title></item>
                <item><title>First headline</title></item>
                <item><description>no title at all</description></item>
                <item><title>   </title></item>
                <item><title>Second headline</title></item>
                <item><title>Third headline</title></item>
            </channel></rss>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 2);

        assertThat(outcome.titles()).containsExactly("First headline", "Second headline");
    }

    @Test
    void acceptsContentTypeCaseInsensitively() {
        enqueueFeed("Application/RSS+XML; charset=UTF-8", "<rss><channel><item><title>Upper case header</title></item></channel></rss>");

        assertThat(prober.probe(url(), TIMEOUT, 5).isValid()).isTrue();
    }

    @Test
    void nonSuccessStatusIsInvalid() {
        server.enqueue(new MockResponse()
            .setResponseCode(404)
            .setHeader("Content-Type", "application/rss+xml")
            .setBody("<rss><channel><item><title>Not served</title></item></channel></rss>"));

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.titles()).isEmpty();
        assertThat(outcome.failureReason()).isEqualTo(ProbeFailureReason.HTTP_STATUS);
    }

    @Test
    void nonFeedContentTypeIsInvalid() {
        enqueueFeed("text/html; charset=utf-8", "<rss><channel><item><title>Disguised</title></item></channel></rss>");

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.failureReason()).isEqualTo(ProbeFailureReason.NON_FEED_RESPONSE);
    }

    @Test
    void missingContentTypeIsInvalid() {
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("<rss><channel><item><title>No header</title></item></channel></rss>"));

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.failureReason()).isEqualTo(ProbeFailureReason.NON_FEED_RESPONSE);
    }

    @Test
    void xmlThatIsNotAFeedIsInvalid() {
        enqueueFeed("application/xml", "<html><body><h1>Hello</h1></body></html>");

        assertThat(prober.probe(url(), TIMEOUT, 5).failureReason()).isEqualTo(ProbeFailureReason.PARSE_FAILURE);
    }

    @Test
    void unparsableBodyIsInvalid() {
        enqueueFeed("application/rss+xml", "this is plain text and not a document");

        assertThat(prober.probe(url(), TIMEOUT, 5).failureReason()).isEqualTo(ProbeFailureReason.PARSE_FAILURE);
    }

    @Test
    void feedWithOnlyBlankTitlesIsInvalid() {
        enqueueFeed("application/rss+xml", """
            <rss><channel>
                <title>Empty channel</title>
                <item><title></title></item>
                <item><description>untitled</description></item>
                <item><title>   </title></item>
            </channel></rss>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.failureReason()).isEqualTo(ProbeFailureReason.EMPTY_FEED);
    }

    @Test
    void titleThatNormalizesToEmptyStillCountsTowardTheLimit() {
        enqueueFeed("application/rss+xml", """
            <rss><channel>
                <item><title>🚀</title></item>
                <item><title>Alpha headline</title></item>
                <item><title>Beta headline</title></item>
            </channel></rss>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 2);

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.titles()).containsExactly("", "Alpha headline");
    }

    @Test
    void emojiOnlyFeedIsValidWithEmptyTitles() {
        enqueueFeed("application/rss+xml", """
            <rss><channel>
                <item><title>🚀🚀</title></item>
                <item><title><![CDATA[<br/>]]></title></item>
            </channel></rss>
            """);

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.titles()).containsExactly("", "");
    }

    @Test
    void decodesBodyWithCharsetFromContentType() {
        byte[] latin1 = "<rss><channel><item><title>Café crème prices rise</title></item></channel></rss>"
            .getBytes(StandardCharsets.ISO_8859_1);
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/rss+xml; charset=ISO-8859-1")
            .setBody(new Buffer().write(latin1)));

        FetchOutcome outcome = prober.probe(url(), TIMEOUT, 5);

        assertThat(outcome.titles()).containsExactly("Café crème prices rise");
    }

    @Test
    void tricklingBodyIsCutOffAtTheTimeout() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/rss+xml")
            .throttleBody(10, 1, TimeUnit.SECONDS)
            .setBody("<rss><channel><item><title>Slowly delivered headline</title></item></channel></rss>"));

        long started = System.nanoTime();
        FetchOutcome outcome = prober.probe(url(), Duration.ofMillis(500), 5);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(outcome.failureReason()).isEqualTo(ProbeFailureReason.TIMEOUT);
        assertThat(elapsedMs).isLessThan(3_000);
    }

    @Test
    void slowServerIsInvalidNotAnError() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/rss+xml")
            .setHeadersDelay(3, TimeUnit.SECONDS)
            .setBody("<rss/>"));

        FetchOutcome outcome = prober.probe(url(), Duration.ofMillis(300), 5);

        assertThat(outcome.failureReason()).isEqualTo(ProbeFailureReason.TIMEOUT);
    }

    @Test
    void unreachableHostIsInvalidNotAnError() throws Exception {
        String target = url();
        server.shutdown();
        server = null;

        FetchOutcome outcome = prober.probe(target, TIMEOUT, 5);

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.failureReason()).isIn(ProbeFailureReason.NETWORK_FAILURE, ProbeFailureReason.TIMEOUT);
    }

    @Test
    void contentTypeHeuristicLooksForXmlOrRssMarkers() {
        assertThat(JsoupFeedProber.isFeedContentType("application/rss+xml")).isTrue();
        assertThat(JsoupFeedProber.isFeedContentType("text/xml")).isTrue();
        assertThat(JsoupFeedProber.isFeedContentType("application/rss")).isTrue();
        assertThat(JsoupFeedProber.isFeedContentType("application/json")).isFalse();
        assertThat(JsoupFeedProber.isFeedContentType(null)).isFalse();
    }

    private void enqueueFeed(String contentType, String body) {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", contentType)
            .setBody(body));
    }

    private String url() {
        return server.url("/rss").toString();
    }
}
