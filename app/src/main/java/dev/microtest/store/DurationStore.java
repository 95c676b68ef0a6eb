package dev.microtest.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.microtest.BuildInfo;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Last observed duration per test, persisted between runs to print time estimates.
 *
 * <p>The file read at {@link #load(Path)} becomes an immutable snapshot that answers {@link #estimate(String)}.
 * Durations measured during the run go into a separate accumulator (seeded from the snapshot) that
 * {@link #save()} writes back as a full overwrite. Reading never fails: a missing, unreadable or malformed file
 * yields an empty store. Writing never throws: on failure the previous file stays in place.
 *
 * <p>There is no locking; concurrent runs against one file are last-writer-wins.
 */
public final class DurationStore {
    private static final Logger logger = LogManager.getLogger(DurationStore.class);
    private static final ObjectMapper objectMapper =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String DEFAULT_FILE_NAME = ".microtest.json";

    static final String COMMENT_FIELD = "_comment";
    static final String VERSION_FIELD = "microtest_version";
    static final String DURATIONS_FIELD = "test_durations";
    static final String COMMENT =
            "This file is optional: it stores data about the last run of tests for doing time estimates.";

    private final Path file;
    private final Map<String, Double> snapshot;
    private final Map<String, Double> durations;

    private DurationStore(Path file, Map<String, Double> snapshot) {
        this.file = file;
        this.snapshot = Map.copyOf(snapshot);
        this.durations = new LinkedHashMap<>(snapshot);
    }

    /** Loads the store kept in {@code file}; any problem reading it yields an empty store. */
    public static DurationStore load(Path file) {
        Objects.requireNonNull(file, "file");
        return new DurationStore(file, readDurations(file));
    }

    /** Creates an empty store that will be written to {@code file}. */
    public static DurationStore empty(Path file) {
        return new DurationStore(Objects.requireNonNull(file, "file"), Map.of());
    }

    /** Builds the stable key for one test: {@code "<relative-file-path>::<unit-name>"}. */
    public static String key(String file, String testName) {
        return file + "::" + testName;
    }

    /** Duration observed for {@code key} in the loaded snapshot, if there was one. */
    public OptionalDouble estimate(String key) {
        Double value = snapshot.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /** Sum of the known estimates for {@code keys}; unknown keys count as zero. */
    public double estimateTotal(Collection<String> keys) {
        return keys.stream().mapToDouble(k -> snapshot.getOrDefault(k, 0.0)).sum();
    }

    /** Records the measured duration, replacing what the accumulator held for {@code key}. */
    public void record(String key, double seconds) {
        Objects.requireNonNull(key, "key");
        if (!isValidDuration(seconds)) {
            throw new IllegalArgumentException("duration must be a finite, non-negative number: " + seconds);
        }
        durations.put(key, seconds);
    }

    /** Copy of the accumulated durations, snapshot entries included. */
    public Map<String, Double> durations() {
        return Map.copyOf(durations);
    }

    /** The durations as loaded, unaffected by {@link #record(String, double)}. */
    public Map<String, Double> snapshot() {
        return snapshot;
    }

    public Path file() {
        return file;
    }

    /**
     * Writes the accumulated durations, replacing the whole file. The content goes to a temporary file next to the
     * target first and is then moved over it.
     *
     * @return true if the file was written
     */
    public boolean save() {
        var content = new LinkedHashMap<String, Object>();
        content.put(COMMENT_FIELD, COMMENT);
        content.put(VERSION_FIELD, BuildInfo.version);
        content.put(DURATIONS_FIELD, new TreeMap<>(durations));

        Path dir = file.toAbsolutePath().getParent();
        Path temp = null;
        try {
            String json = objectMapper.writeValueAsString(content);
            temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Stored {} test durations in {}", durations.size(), file);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to store test durations in {}: {}", file, e.getMessage());
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    logger.debug("Could not remove temporary file {}", temp, cleanup);
                }
            }
            return false;
        }
    }

    private static Map<String, Double> readDurations(Path file) {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            logger.debug("No duration store at {}", file);
            return Map.of();
        } catch (IOException e) {
            logger.warn("Ignoring unreadable duration store {}: {}", file, e.getMessage());
            return Map.of();
        }

        JsonNode node = root == null ? null : root.get(DURATIONS_FIELD);
        if (node == null || !node.isObject()) {
            logger.debug("Duration store {} holds no {} object", file, DURATIONS_FIELD);
            return Map.of();
        }

        var result = new LinkedHashMap<String, Double>();
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isNumber() && isValidDuration(value.doubleValue())) {
                result.put(entry.getKey(), value.doubleValue());
            } else {
                logger.debug("Dropping invalid duration for {}: {}", entry.getKey(), value);
            }
        });
        return result;
    }

    private static boolean isValidDuration(double seconds) {
        return Double.isFinite(seconds) && seconds >= 0;
    }
}
