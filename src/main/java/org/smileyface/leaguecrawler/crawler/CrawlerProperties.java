package org.smileyface.leaguecrawler.crawler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.time.Duration;

/**
 * Configuration properties for the country / league / team crawl.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    Logger log = LogManager.getLogger(CrawlerProperties.class);

    /** Root page used to discover countries and their leagues. */
    private String entryUrl = "https://www.flashscore.com";

    /** User agent sent by both fetcher implementations. */
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64)";

    /** Page navigation timeout in milliseconds. */
    private int navigationTimeoutMs = 30000;

    /** Readiness timeout for the country and league menus. */
    private int discoveryTimeoutMs = 5000;

    /** How long to look for the cookie-consent banner before giving up silently. */
    private int cookieBannerTimeoutMs = 5000;

    /**
     * When set, the Playwright fetcher writes an HTML dump and a full-page screenshot of every
     * page it renders (entry menu and standings pages alike) into this directory, named after the
     * last path segment of the URL.
     */
    private String debugDumpDirectory;

    /** Run the crawl as soon as the application context is ready. */
    private boolean runOnStartup = true;

    private Fetcher fetcher = new Fetcher();
    private Retry retry = new Retry();
    private RateLimit rateLimit = new RateLimit();
    private Output output = new Output();
    private Mirror mirror = new Mirror();
    private Selectors selectors = new Selectors();

    /**
     * Loads default values from classpath resource LeagueCrawlerConfig.json if available.
     * Spring will still bind/override values from application properties as usual.
     */
    public CrawlerProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("LeagueCrawlerConfig.json")) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper()
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                LeagueCrawlerConfig cfg = mapper.readValue(in, LeagueCrawlerConfig.class);
                if (cfg.entryUrl != null && !cfg.entryUrl.isBlank()) this.entryUrl = cfg.entryUrl;
                if (cfg.userAgent != null && !cfg.userAgent.isBlank()) this.userAgent = cfg.userAgent;
                if (cfg.navigationTimeoutMs != null && cfg.navigationTimeoutMs > 0) {
                    this.navigationTimeoutMs = cfg.navigationTimeoutMs;
                }
                if (cfg.mirrorSourceHost != null && !cfg.mirrorSourceHost.isBlank()) {
                    this.mirror.setSourceHost(cfg.mirrorSourceHost);
                }
                if (cfg.selectors != null) this.selectors = cfg.selectors;
            }
        } catch (Exception e) {
            // Keep defaults when file missing or malformed; do not fail application startup
            log.error("Failed to load default crawler configuration from classpath resource LeagueCrawlerConfig.json", e);
        }
    }

    public String getEntryUrl() {
        return entryUrl;
    }

    public void setEntryUrl(String entryUrl) {
        this.entryUrl = entryUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getNavigationTimeoutMs() {
        return navigationTimeoutMs;
    }

    public void setNavigationTimeoutMs(int navigationTimeoutMs) {
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    public int getDiscoveryTimeoutMs() {
        return discoveryTimeoutMs;
    }

    public void setDiscoveryTimeoutMs(int discoveryTimeoutMs) {
        this.discoveryTimeoutMs = discoveryTimeoutMs;
    }

    public int getCookieBannerTimeoutMs() {
        return cookieBannerTimeoutMs;
    }

    public void setCookieBannerTimeoutMs(int cookieBannerTimeoutMs) {
        this.cookieBannerTimeoutMs = cookieBannerTimeoutMs;
    }

    public String getDebugDumpDirectory() {
        return debugDumpDirectory;
    }

    public void setDebugDumpDirectory(String debugDumpDirectory) {
        this.debugDumpDirectory = (debugDumpDirectory == null || debugDumpDirectory.isBlank()) ? null : debugDumpDirectory;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public Fetcher getFetcher() {
        return fetcher;
    }

    public void setFetcher(Fetcher fetcher) {
        this.fetcher = fetcher != null ? fetcher : new Fetcher();
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry != null ? retry : new Retry();
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit != null ? rateLimit : new RateLimit();
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output != null ? output : new Output();
    }

    public Mirror getMirror() {
        return mirror;
    }

    public void setMirror(Mirror mirror) {
        this.mirror = mirror != null ? mirror : new Mirror();
    }

    public Selectors getSelectors() {
        return selectors;
    }

    public void setSelectors(Selectors selectors) {
        this.selectors = selectors != null ? selectors : new Selectors();
    }

    // --------- Nested property groups ---------

    public static class Fetcher {
        /** "playwright" (headless Chromium) or "jsoup" (static HTML only). */
        private String type = "playwright";
        private boolean headless = true;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }
    }

    public static class Retry {
        private int maxAttempts = 2;
        /** Team readiness timeout for regular leagues. */
        private int defaultTimeoutMs = 5000;
        /** Shorter readiness timeout for cup/knockout URLs, which usually render brackets only. */
        private int cupTimeoutMs = 3000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public int getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(int defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

        public int getCupTimeoutMs() { return cupTimeoutMs; }
        public void setCupTimeoutMs(int cupTimeoutMs) { this.cupTimeoutMs = cupTimeoutMs; }
    }

    public static class RateLimit {
        /** Pause after every league fetch, successful or not. */
        private Duration delay = Duration.ofMillis(1500);

        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay != null ? delay : Duration.ZERO; }
    }

    public static class Output {
        private String directory = "./data";
        private String prefix = "flashscore";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) {
            this.prefix = (prefix == null || prefix.isBlank()) ? "flashscore" : prefix;
        }
    }

    public static class Mirror {
        private String sourceHost = "flashscore.com";
        /** Mirror links ("urlUSA") are only written when a target host is configured. */
        private String targetHost;

        public String getSourceHost() { return sourceHost; }
        public void setSourceHost(String sourceHost) { this.sourceHost = sourceHost; }

        public String getTargetHost() { return targetHost; }
        public void setTargetHost(String targetHost) { this.targetHost = targetHost; }
    }

    /**
     * CSS selectors describing the site layout. Public fields so the same class maps straight
     * from LeagueCrawlerConfig.json.
     */
    public static class Selectors {
        public String countryMenuToggle = "#category-left-menu > div > span";
        public String countryItems = "[id^=\"country_\"]";
        public String countryName = "span";
        public String countryUrlAttribute = "data-tournament-url";
        /** %s is replaced by the country's DOM id. */
        public String leagueLinksTemplate = "#%s ~ span > a";
        public String teamLinks = "a[href*=\"/team/\"]";
        public String cookieAccept = "#onetrust-accept-btn-handler";

        public String getCountryMenuToggle() { return countryMenuToggle; }
        public void setCountryMenuToggle(String countryMenuToggle) { this.countryMenuToggle = countryMenuToggle; }

        public String getCountryItems() { return countryItems; }
        public void setCountryItems(String countryItems) { this.countryItems = countryItems; }

        public String getCountryName() { return countryName; }
        public void setCountryName(String countryName) { this.countryName = countryName; }

        public String getCountryUrlAttribute() { return countryUrlAttribute; }
        public void setCountryUrlAttribute(String countryUrlAttribute) { this.countryUrlAttribute = countryUrlAttribute; }

        public String getLeagueLinksTemplate() { return leagueLinksTemplate; }
        public void setLeagueLinksTemplate(String leagueLinksTemplate) { this.leagueLinksTemplate = leagueLinksTemplate; }

        public String getTeamLinks() { return teamLinks; }
        public void setTeamLinks(String teamLinks) { this.teamLinks = teamLinks; }

        public String getCookieAccept() { return cookieAccept; }
        public void setCookieAccept(String cookieAccept) { this.cookieAccept = cookieAccept; }

        public String leagueLinksFor(String countryId) {
            return String.format(leagueLinksTemplate, countryId);
        }
    }

    // --------- Nested config DTO for JSON mapping ---------
    public static class LeagueCrawlerConfig {
        public String entryUrl;
        public String userAgent;
        public Integer navigationTimeoutMs;
        public String mirrorSourceHost;
        public Selectors selectors;
    }
}
