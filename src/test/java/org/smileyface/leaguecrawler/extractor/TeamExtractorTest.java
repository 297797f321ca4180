package org.smileyface.leaguecrawler.extractor;

import org.junit.jupiter.api.Test;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.smileyface.leaguecrawler.fetcher.RenderedPage;
import org.smileyface.leaguecrawler.model.Team;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.smileyface.leaguecrawler.testutil.FlashscorePages.standingsPage;
import static org.smileyface.leaguecrawler.testutil.FlashscorePages.teamLink;

class TeamExtractorTest {

    private static final String STANDINGS = "https://www.flashscore.com/football/england/premier-league/standings/";

    private final TeamExtractor extractor = new TeamExtractor(new CrawlerProperties.Selectors());

    @Test
    void extract_usesLastPathSegmentAsId() {
        String page = standingsPage(
                teamLink("arsenal", "hA1Zm19f", "Arsenal"),
                teamLink("chelsea", "4fGZN2oK", "Chelsea"));

        Map<String, Team> teams = extractor.extract(new RenderedPage(STANDINGS, page));

        assertThat(teams.keySet()).containsExactly("hA1Zm19f", "4fGZN2oK");
        assertThat(teams.get("hA1Zm19f")).isEqualTo(
                new Team("hA1Zm19f", "Arsenal", "https://www.flashscore.com/team/arsenal/hA1Zm19f/"));
    }

    @Test
    void extract_firstNamedLinkWins() {
        String page = standingsPage(
                "<a href='/team/arsenal/hA1Zm19f/'><img src='logo.png'/></a>",
                teamLink("arsenal", "hA1Zm19f", "Arsenal"),
                teamLink("arsenal", "hA1Zm19f", "ARS"));

        Map<String, Team> teams = extractor.extract(new RenderedPage(STANDINGS, page));

        assertThat(teams).hasSize(1);
        assertThat(teams.get("hA1Zm19f").name()).isEqualTo("Arsenal");
    }

    @Test
    void extract_ignoresLinksNotShapedLikeTeamPages() {
        String page = standingsPage(
                "<a href='/team/'>Broken</a>",
                "<a href='/teams/list/'>All teams</a>",
                teamLink("liverpool", "lId4Tc2V", "Liverpool"));

        Map<String, Team> teams = extractor.extract(new RenderedPage(STANDINGS, page));

        assertThat(teams.keySet()).containsExactly("lId4Tc2V");
    }

    @Test
    void extract_pageWithoutTeamsYieldsEmptyMap() {
        assertThat(extractor.extract(new RenderedPage(STANDINGS, standingsPage("<p>Draw</p>")))).isEmpty();
    }
}
