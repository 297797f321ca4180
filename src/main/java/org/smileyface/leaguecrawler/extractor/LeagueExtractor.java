package org.smileyface.leaguecrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.smileyface.leaguecrawler.fetcher.RenderedPage;
import org.smileyface.leaguecrawler.model.League;
import org.smileyface.leaguecrawler.util.CrawlerUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the league links shown under one expanded country menu item.
 */
public final class LeagueExtractor implements EntityExtractor<League> {

    private final String linkSelector;

    public LeagueExtractor(CrawlerProperties.Selectors selectors, String countryId) {
        Objects.requireNonNull(selectors, "selectors");
        if (countryId == null || countryId.isBlank()) {
            throw new IllegalArgumentException("countryId must not be null/blank");
        }
        this.linkSelector = selectors.leagueLinksFor(countryId);
    }

    /**
     * @return the CSS selector this extractor applies, also used as the page readiness selector
     */
    public String getLinkSelector() {
        return linkSelector;
    }

    @Override
    public Map<String, League> extract(RenderedPage page) {
        Map<String, League> out = new LinkedHashMap<>();
        if (page.html() == null || page.html().isBlank()) return out;

        Document doc = Jsoup.parse(page.html(), page.url());
        for (Element a : doc.select(linkSelector)) {
            String name = a.text().trim();
            String url = a.absUrl("href");
            if (url.isEmpty()) url = a.attr("href");
            if (name.isEmpty() || url.isBlank()) continue;

            String id = CrawlerUtils.slug(url);
            out.putIfAbsent(id, new League(id, name, url, CrawlerUtils.isCup(url)));
        }
        return out;
    }
}
