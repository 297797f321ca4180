package org.smileyface.leaguecrawler.fetcher;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;

import java.io.IOException;
import java.util.Objects;

/**
 * Fetches pages over plain HTTP with Jsoup, without executing JavaScript. Click selectors cannot
 * be performed on static HTML, so the menus they would expand must already be present in the
 * served markup. Used for sites that render server-side and for end-to-end tests.
 */
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final CrawlerProperties properties;

    public JsoupPageFetcher(CrawlerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public void open() {
        // nothing to acquire
    }

    @Override
    public RenderedPage fetch(FetchRequest request) throws FetchException {
        String url = request.url();
        Document doc;
        try {
            Connection conn = Jsoup.connect(url)
                    .userAgent(Objects.toString(properties.getUserAgent(), "Mozilla/5.0"))
                    .timeout(Math.max(0, request.navigationTimeoutMs()))
                    .followRedirects(true);
            Connection.Response res = conn.execute();
            doc = res.parse();
        } catch (IOException e) {
            throw new FetchException(url, "Failed to fetch " + url + ": " + e.getMessage(), e);
        }

        if (!request.clickSelectors().isEmpty()) {
            log.trace("Ignoring click selectors {} for static fetch of {}", request.clickSelectors(), url);
        }
        if (doc.selectFirst(request.readySelector()) == null) {
            throw new FetchException(url, "Selector '" + request.readySelector() + "' not found on " + url);
        }
        return new RenderedPage(doc.location(), doc.outerHtml());
    }

    @Override
    public void close() {
        // nothing to release
    }
}
