package org.smileyface.leaguecrawler.checkpoint;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File naming for one run: {@code <prefix>-temp-<yyyyMMdd>.json} for the checkpoint and
 * {@code <prefix>-final-<yyyyMMdd>.json} for the final snapshot, dated in UTC.
 */
public final class CheckpointFiles {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path directory;
    private final String prefix;
    private final LocalDate runDate;

    public CheckpointFiles(Path directory, String prefix, LocalDate runDate) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.runDate = Objects.requireNonNull(runDate, "runDate");
    }

    public static CheckpointFiles forToday(Path directory, String prefix, Clock clock) {
        return new CheckpointFiles(directory, prefix, LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    }

    public Path getDirectory() {
        return directory;
    }

    public LocalDate getRunDate() {
        return runDate;
    }

    public Path checkpointPath() {
        return directory.resolve(prefix + "-temp-" + DAY.format(runDate) + ".json");
    }

    public Path finalPath() {
        return directory.resolve(prefix + "-final-" + DAY.format(runDate) + ".json");
    }

    /**
     * Checkpoints left by runs on other days, newest first. They are never resumed
     * automatically; copying one over today's checkpoint resumes it.
     */
    public List<Path> earlierCheckpoints() {
        if (!Files.isDirectory(directory)) return List.of();
        Pattern pattern = Pattern.compile(Pattern.quote(prefix) + "-temp-\\d{8}\\.json");
        Path today = checkpointPath().getFileName();
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(p -> pattern.matcher(p.getFileName().toString()).matches())
                    .filter(p -> !p.getFileName().equals(today))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }
}
