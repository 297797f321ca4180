package org.smileyface.leaguecrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.smileyface.leaguecrawler.fetcher.RenderedPage;
import org.smileyface.leaguecrawler.model.Country;
import org.smileyface.leaguecrawler.util.CrawlerUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the expanded country menu. Each item carries its DOM id, a {@code span} with the
 * display name and a site-relative tournament path.
 */
public final class CountryExtractor implements EntityExtractor<Country> {

    private final CrawlerProperties.Selectors selectors;

    public CountryExtractor(CrawlerProperties.Selectors selectors) {
        this.selectors = Objects.requireNonNull(selectors, "selectors");
    }

    @Override
    public Map<String, Country> extract(RenderedPage page) {
        Map<String, Country> out = new LinkedHashMap<>();
        if (page.html() == null || page.html().isBlank()) return out;

        Document doc = Jsoup.parse(page.html(), page.url());
        String origin = CrawlerUtils.originOf(page.url());
        for (Element item : doc.select(selectors.getCountryItems())) {
            String id = item.id();
            Element nameEl = item.selectFirst(selectors.getCountryName());
            String name = nameEl != null ? nameEl.text().trim() : "";
            if (id.isBlank() || name.isEmpty() || out.containsKey(id)) continue;

            String path = item.attr(selectors.getCountryUrlAttribute()).trim();
            if (path.startsWith("/")) path = path.substring(1);
            out.put(id, new Country(id, name, origin + "/" + path));
        }
        return out;
    }
}
