package org.smileyface.leaguecrawler.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes {@link ProgressSnapshot}s as pretty-printed UTF-8 JSON. The only path by which
 * crawl state reaches durable storage.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final ObjectMapper mapper;

    public CheckpointStore() {
        this(new ObjectMapper());
    }

    public CheckpointStore(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads the snapshot stored at {@code path}.
     * <ul>
     *   <li>missing file: empty snapshot</li>
     *   <li>unparseable file: empty snapshot; the damaged file is moved aside to
     *   {@code <name>.corrupt-<epochMillis>}</li>
     * </ul>
     * The shape of parseable JSON is not validated beyond what data binding enforces.
     *
     * @throws UncheckedIOException when an existing file cannot be read
     */
    public ProgressSnapshot load(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.info("No checkpoint at {}, starting with an empty snapshot", path);
            return new ProgressSnapshot();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + path, e);
        }

        try {
            ProgressSnapshot snapshot = mapper.readValue(bytes, ProgressSnapshot.class);
            if (snapshot == null) {
                return new ProgressSnapshot();
            }
            log.info("Loaded checkpoint {} ({} countries, {} leagues, {} teams)",
                    path, snapshot.getCountries().size(), snapshot.leagueCount(), snapshot.teamCount());
            return snapshot;
        } catch (IOException e) {
            // JsonProcessingException covers malformed and unbindable content alike
            Path aside = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.warn("Checkpoint {} is not readable JSON ({}); starting with an empty snapshot",
                    path, firstLine(e.getMessage()));
            moveAside(path, aside);
            return new ProgressSnapshot();
        }
    }

    /**
     * Writes the whole snapshot to {@code path}. The content goes to a sibling temp file first,
     * which then replaces the target, so a crash mid-write leaves the previous checkpoint intact.
     */
    public void save(ProgressSnapshot snapshot, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), snapshot);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to serialise snapshot for " + path, e);
        }
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.trace("Snapshot written to {}", path);
    }

    private void moveAside(Path path, Path aside) {
        try {
            Files.move(path, aside, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Damaged checkpoint kept as {}", aside);
        } catch (IOException e) {
            log.warn("Could not move damaged checkpoint {} aside: {}", path, e.getMessage());
        }
    }

    private static String firstLine(String message) {
        if (message == null) return null;
        int nl = message.indexOf('\n');
        return nl >= 0 ? message.substring(0, nl) : message;
    }
}
