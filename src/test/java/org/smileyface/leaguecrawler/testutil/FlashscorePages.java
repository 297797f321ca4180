package org.smileyface.leaguecrawler.testutil;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Builds minimal pages shaped like the site's country menu and standings tables.
 */
public final class FlashscorePages {

    private FlashscorePages() {
    }

    /**
     * Entry page with the country menu. Each country item sits in its own wrapper together with
     * the spans holding its league links, as the expanded menu renders them.
     */
    public static String entryPage(Country... countries) {
        String items = Arrays.stream(countries).map(Country::html).collect(Collectors.joining("\n"));
        return html("<div id='category-left-menu'><div><span>More</span></div>" + items + "</div>");
    }

    public static String standingsPage(String... teamLinks) {
        return html("<div class='table'>" + String.join("\n", teamLinks) + "</div>");
    }

    public static String teamLink(String slug, String id, String name) {
        return "<a href='/team/" + slug + "/" + id + "/'>" + name + "</a>";
    }

    public static String html(String body) {
        return "<!doctype html><html><head><title>T</title></head><body>" + body + "</body></html>";
    }

    public static Country country(String id, String name, String path, String... leagueLinks) {
        return new Country(id, name, path, leagueLinks);
    }

    public static String leagueLink(String href, String name) {
        return "<a href='" + href + "'>" + name + "</a>";
    }

    public static final class Country {
        private final String id;
        private final String name;
        private final String path;
        private final String[] leagueLinks;

        Country(String id, String name, String path, String... leagueLinks) {
            this.id = id;
            this.name = name;
            this.path = path;
            this.leagueLinks = leagueLinks;
        }

        String html() {
            String leagues = Arrays.stream(leagueLinks)
                    .map(l -> "<span class='lmc__template'>" + l + "</span>")
                    .collect(Collectors.joining());
            return "<div class='lmc__block'><a id='" + id + "' class='lmc__item' data-tournament-url='" + path + "'>"
                    + "<span class='lmc__elementName'>" + name + "</span></a>" + leagues + "</div>";
        }
    }
}
