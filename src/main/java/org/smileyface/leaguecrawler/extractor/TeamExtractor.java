package org.smileyface.leaguecrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.smileyface.leaguecrawler.fetcher.RenderedPage;
import org.smileyface.leaguecrawler.model.Team;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the teams linked from a standings page. A team is usually linked several times
 * (logo, name, form table); only the first link with a non-blank text counts.
 */
public final class TeamExtractor implements EntityExtractor<Team> {

    // /team/<slug>/<id>
    private static final Pattern TEAM_ID = Pattern.compile("/team/[^/]+/([^/?#]+)");

    private final CrawlerProperties.Selectors selectors;

    public TeamExtractor(CrawlerProperties.Selectors selectors) {
        this.selectors = Objects.requireNonNull(selectors, "selectors");
    }

    @Override
    public Map<String, Team> extract(RenderedPage page) {
        Map<String, Team> out = new LinkedHashMap<>();
        if (page.html() == null || page.html().isBlank()) return out;

        Document doc = Jsoup.parse(page.html(), page.url());
        for (Element a : doc.select(selectors.getTeamLinks())) {
            String href = a.absUrl("href");
            if (href.isEmpty()) href = a.attr("href");
            Matcher m = TEAM_ID.matcher(href);
            String name = a.text().trim();
            if (!m.find() || name.isEmpty()) continue;

            String id = m.group(1);
            out.putIfAbsent(id, new Team(id, name, href));
        }
        return out;
    }
}
