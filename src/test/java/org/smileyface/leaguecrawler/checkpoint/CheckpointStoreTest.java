package org.smileyface.leaguecrawler.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smileyface.leaguecrawler.model.LeagueStatus;
import org.smileyface.leaguecrawler.model.Team;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointStoreTest {

    @TempDir
    Path dir;

    private final CheckpointStore store = new CheckpointStore();

    @Test
    void saveThenLoad_preservesLeaguesAndTeams() throws IOException {
        ProgressSnapshot snapshot = sampleSnapshot();
        Path file = dir.resolve("flashscore-temp-20240101.json");

        store.save(snapshot, file);
        ProgressSnapshot loaded = store.load(file);

        assertThat(loaded).isEqualTo(snapshot);
        assertThat(loaded.getCountries().keySet()).containsExactly("England", "Spain");
        LeagueProgress cup = loaded.league("England", "FA Cup").orElseThrow();
        assertThat(cup.isCup()).isTrue();
        assertThat(cup.getStatus()).isEqualTo(LeagueStatus.CONFIRMED_EMPTY);
    }

    @Test
    void save_writesNameKeyedJsonWithStatus() throws IOException {
        Path file = dir.resolve("out.json");
        store.save(sampleSnapshot(), file);

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        JsonNode england = root.get("England");
        assertThat(england.get("slug").asText()).isEqualTo("england");
        assertThat(england.get("urlUSA").asText()).isEqualTo("https://www.flashscoreusa.com/football/england/");

        JsonNode pl = england.get("leagues").get("Premier League");
        assertThat(pl.get("isCup").asBoolean()).isFalse();
        assertThat(pl.get("status").asText()).isEqualTo("complete");
        assertThat(pl.get("teams").get(0).get("id").asText()).isEqualTo("hA1Zm19f");

        JsonNode cup = england.get("leagues").get("FA Cup");
        assertThat(cup.get("status").asText()).isEqualTo("confirmed-empty");
        assertThat(cup.get("teams").get(0).get("url").isNull()).isTrue();

        JsonNode spain = root.get("Spain");
        assertThat(spain.has("urlUSA")).isFalse();
        assertThat(spain.get("leagues").get("LaLiga").get("status").asText()).isEqualTo("pending");
    }

    @Test
    void save_leavesNoTempFileBehind() throws IOException {
        Path file = dir.resolve("nested/flashscore-temp-20240101.json");

        store.save(sampleSnapshot(), file);
        store.save(sampleSnapshot(), file);

        try (Stream<Path> files = Files.list(file.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("flashscore-temp-20240101.json");
        }
    }

    @Test
    void load_missingFileGivesEmptySnapshot() {
        ProgressSnapshot loaded = store.load(dir.resolve("does-not-exist.json"));

        assertThat(loaded.isEmpty()).isTrue();
    }

    @Test
    void load_corruptFileIsMovedAsideAndGivesEmptySnapshot() throws IOException {
        Path file = dir.resolve("flashscore-temp-20240101.json");
        Files.writeString(file, "{\"England\": {\"slug\": \"eng", StandardCharsets.UTF_8);

        ProgressSnapshot loaded = store.load(file);

        assertThat(loaded.isEmpty()).isTrue();
        assertThat(file).doesNotExist();
        List<String> names;
        try (Stream<Path> files = Files.list(dir)) {
            names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        }
        assertThat(names).hasSize(1);
        assertThat(names.get(0)).startsWith("flashscore-temp-20240101.json.corrupt-");
    }

    @Test
    void load_legacyFileWithoutStatusDerivesIt() throws IOException {
        Path file = dir.resolve("legacy.json");
        Files.writeString(file, """
                {
                  "England": {
                    "slug": "england",
                    "url": "https://www.flashscore.com/football/england/",
                    "urlUSA": "https://www.flashscoreusa.com/football/england/",
                    "leagues": {
                      "Premier League": {
                        "slug": "premier-league",
                        "url": "https://www.flashscore.com/football/england/premier-league/",
                        "urlUSA": "https://www.flashscoreusa.com/football/england/premier-league/",
                        "isCup": false,
                        "teams": [ { "id": "hA1Zm19f", "name": "Arsenal", "url": "https://www.flashscore.com/team/arsenal/hA1Zm19f/" } ]
                      },
                      "FA Cup": {
                        "slug": "fa-cup",
                        "url": "https://www.flashscore.com/football/england/fa-cup/",
                        "isCup": true,
                        "teams": [ { "id": "isCup", "name": "isCup", "url": null } ]
                      },
                      "Championship": {
                        "slug": "championship",
                        "url": "https://www.flashscore.com/football/england/championship/",
                        "isCup": false,
                        "teams": []
                      }
                    }
                  }
                }
                """, StandardCharsets.UTF_8);

        ProgressSnapshot loaded = store.load(file);

        assertThat(loaded.league("England", "Premier League").orElseThrow().getStatus()).isEqualTo(LeagueStatus.COMPLETE);
        assertThat(loaded.league("England", "FA Cup").orElseThrow().getStatus()).isEqualTo(LeagueStatus.CONFIRMED_EMPTY);
        assertThat(loaded.league("England", "Championship").orElseThrow().getStatus()).isEqualTo(LeagueStatus.PENDING);
        assertThat(loaded.isLeagueComplete("England", "FA Cup")).isTrue();
        assertThat(loaded.isLeagueComplete("England", "Championship")).isFalse();
        assertThat(loaded.pendingLeagues()).containsExactly("England / Championship");
    }

    @Test
    void load_nullTeamEntriesAreDroppedAndFileSavesAgain() throws IOException {
        Path file = dir.resolve("flashscore-temp-20240101.json");
        Files.writeString(file, """
                {
                  "England": {
                    "slug": "england",
                    "url": "https://www.flashscore.com/football/england/",
                    "leagues": {
                      "Premier League": {
                        "slug": "premier-league",
                        "url": "https://www.flashscore.com/football/england/premier-league/",
                        "isCup": false,
                        "status": "complete",
                        "teams": [ null ]
                      },
                      "Championship": {
                        "slug": "championship",
                        "url": "https://www.flashscore.com/football/england/championship/",
                        "isCup": false,
                        "teams": [ null, { "id": "l33ds", "name": "Leeds", "url": "https://www.flashscore.com/team/leeds/l33ds/" } ]
                      }
                    }
                  }
                }
                """, StandardCharsets.UTF_8);

        ProgressSnapshot loaded = store.load(file);

        LeagueProgress pl = loaded.league("England", "Premier League").orElseThrow();
        assertThat(pl.getTeams()).isEmpty();
        assertThat(pl.getStatus()).isEqualTo(LeagueStatus.PENDING);
        assertThat(loaded.isLeagueComplete("England", "Premier League")).isFalse();
        assertThat(loaded.league("England", "Championship").orElseThrow().getTeams())
                .extracting(Team::id).containsExactly("l33ds");

        store.save(loaded, file);

        JsonNode saved = new ObjectMapper().readTree(file.toFile()).get("England").get("leagues");
        assertThat(saved.get("Premier League").get("status").asText()).isEqualTo("pending");
        assertThat(saved.get("Premier League").get("teams").size()).isZero();
        assertThat(saved.get("Championship").get("status").asText()).isEqualTo("complete");
    }

    @Test
    void load_nullLeagueEntriesAreDropped() throws IOException {
        Path file = dir.resolve("flashscore-temp-20240101.json");
        Files.writeString(file, """
                {
                  "England": {
                    "slug": "england",
                    "url": "https://www.flashscore.com/football/england/",
                    "leagues": { "Premier League": null }
                  },
                  "Spain": null
                }
                """, StandardCharsets.UTF_8);

        ProgressSnapshot loaded = store.load(file);

        assertThat(loaded.getCountries().keySet()).containsExactly("England");
        assertThat(loaded.country("England").orElseThrow().getLeagues()).isEmpty();
        assertThat(loaded.teamCount()).isZero();
        assertThat(loaded.isLeagueComplete("England", "Premier League")).isFalse();
    }

    @Test
    void load_directoryInsteadOfFileIsFatal() throws IOException {
        Path notAFile = Files.createDirectory(dir.resolve("checkpoint.json"));

        assertThatThrownBy(() -> store.load(notAFile)).isInstanceOf(UncheckedIOException.class);
    }

    static ProgressSnapshot sampleSnapshot() {
        ProgressSnapshot snapshot = new ProgressSnapshot();
        snapshot.ensureCountry("England", "england", "https://www.flashscore.com/football/england/",
                "https://www.flashscoreusa.com/football/england/");
        snapshot.putLeague("England", "Premier League", new LeagueProgress("premier-league",
                "https://www.flashscore.com/football/england/premier-league/",
                "https://www.flashscoreusa.com/football/england/premier-league/", false,
                List.of(new Team("hA1Zm19f", "Arsenal", "https://www.flashscore.com/team/arsenal/hA1Zm19f/"))));
        snapshot.putLeague("England", "FA Cup", new LeagueProgress("fa-cup",
                "https://www.flashscore.com/football/england/fa-cup/",
                "https://www.flashscoreusa.com/football/england/fa-cup/", true, List.of(Team.cupSentinel())));
        snapshot.ensureCountry("Spain", "spain", "https://www.flashscore.com/football/spain/", null);
        snapshot.putLeague("Spain", "LaLiga", new LeagueProgress("laliga",
                "https://www.flashscore.com/football/spain/laliga/", null, false, List.of()));
        return snapshot;
    }
}
