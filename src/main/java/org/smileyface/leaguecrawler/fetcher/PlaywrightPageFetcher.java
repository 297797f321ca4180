package org.smileyface.leaguecrawler.fetcher;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.smileyface.leaguecrawler.util.CrawlerUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Renders pages in headless Chromium through Playwright. A single browser context is shared by
 * all fetches of a run; every fetch gets its own page, closed when the fetch returns.
 */
public class PlaywrightPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightPageFetcher.class);

    private final CrawlerProperties properties;

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private boolean cookiesAccepted;

    public PlaywrightPageFetcher(CrawlerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public synchronized void open() throws FetchException {
        if (context != null) return;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(
                    new BrowserType.LaunchOptions()
                            .setHeadless(properties.getFetcher().isHeadless())
                            .setArgs(List.of("--no-sandbox"))
            );
            context = browser.newContext(
                    new Browser.NewContextOptions().setUserAgent(properties.getUserAgent())
            );
            log.info("Headless browser launched (headless={})", properties.getFetcher().isHeadless());
        } catch (PlaywrightException e) {
            close();
            throw new FetchException(properties.getEntryUrl(), "Failed to launch headless browser: " + e.getMessage(), e);
        }
    }

    @Override
    public RenderedPage fetch(FetchRequest request) throws FetchException {
        if (context == null) {
            throw new IllegalStateException("PlaywrightPageFetcher is not open");
        }
        String url = request.url();
        try (Page page = context.newPage()) {
            page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(request.navigationTimeoutMs()));
            log.trace("Navigated to {} (landed at {})", url, page.url());

            dismissCookieBanner(page);

            for (String selector : request.clickSelectors()) {
                page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(request.readyTimeoutMs()));
                page.click(selector);
            }

            dumpForDebugging(page, url);

            page.waitForSelector(request.readySelector(),
                    new Page.WaitForSelectorOptions().setTimeout(request.readyTimeoutMs()));
            return new RenderedPage(page.url(), page.content());
        } catch (PlaywrightException e) {
            throw new FetchException(url, "Failed to render " + url + ": " + firstLine(e.getMessage()), e);
        }
    }

    // The banner only shows until consent is stored in the shared context.
    private void dismissCookieBanner(Page page) {
        if (cookiesAccepted) return;
        String selector = properties.getSelectors().getCookieAccept();
        if (selector == null || selector.isBlank()) return;
        try {
            page.waitForSelector(selector,
                    new Page.WaitForSelectorOptions().setTimeout(properties.getCookieBannerTimeoutMs()));
            page.click(selector);
            cookiesAccepted = true;
            log.debug("Cookie banner dismissed");
        } catch (PlaywrightException e) {
            log.trace("No cookie banner found on {}", page.url());
        }
    }

    private void dumpForDebugging(Page page, String url) {
        String dir = properties.getDebugDumpDirectory();
        if (dir == null) return;
        String name = "debug-" + CrawlerUtils.slug(url).replaceAll("[^a-zA-Z0-9]", "_");
        Path htmlPath = Path.of(dir, name + ".html");
        Path pngPath = Path.of(dir, name + ".png");
        try {
            Files.createDirectories(htmlPath.getParent());
            Files.writeString(htmlPath, page.content(), StandardCharsets.UTF_8);
            page.screenshot(new Page.ScreenshotOptions().setPath(pngPath).setFullPage(true));
            log.debug("Debug dump written: {}, {}", htmlPath, pngPath);
        } catch (IOException | PlaywrightException e) {
            log.warn("Failed to write debug dump for {}: {}", url, e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (context != null) context.close();
            if (browser != null) browser.close();
            if (playwright != null) playwright.close();
        } catch (PlaywrightException e) {
            log.warn("Error while closing headless browser: {}", e.getMessage());
        } finally {
            context = null;
            browser = null;
            playwright = null;
        }
    }

    private static String firstLine(String message) {
        if (message == null) return null;
        int nl = message.indexOf('\n');
        return nl >= 0 ? message.substring(0, nl) : message;
    }
}
