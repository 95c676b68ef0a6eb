package dev.microtest.context;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.jetbrains.annotations.Nullable;

/**
 * Logging and artifact sink handed to a single test invocation.
 *
 * <p>Every call appends a timestamped record in emission order and echoes it to the console logger so it shows up
 * live. The engine copies the records and artifacts into the test's result once the test returns or throws.
 *
 * <p>A context serves exactly one test. Only the record list tolerates concurrent appends (e.g. from a
 * {@code Command} line listener); the rest of the state is meant for the test's own thread.
 */
public class TestContext {
    private static final Logger logger = LogManager.getLogger(TestContext.class);

    /** Marks console events that already went into a context, so ambient capture does not record them twice. */
    public static final Marker CONTEXT_MARKER = MarkerManager.getMarker("MICROTEST_CONTEXT");

    private final String file;
    private final String testName;
    private final List<String> args;
    private final long startNanos;
    private final List<LogRecord> records = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Artifact> artifacts = new LinkedHashMap<>();

    private volatile boolean fatal;
    private volatile @Nullable String fatalMessage;

    public TestContext(String file, String testName, List<String> args) {
        this.file = Objects.requireNonNull(file, "file");
        this.testName = Objects.requireNonNull(testName, "testName");
        this.args = List.copyOf(args);
        this.startNanos = System.nanoTime();
    }

    public void debug(String msg) {
        log(LogSeverity.DEBUG, msg);
    }

    public void info(String msg) {
        log(LogSeverity.INFO, msg);
    }

    public void warn(String msg) {
        log(LogSeverity.WARNING, msg);
    }

    public void error(String msg) {
        log(LogSeverity.ERROR, msg);
    }

    /**
     * Logs at CRITICAL and marks the test as failed even if it goes on to return normally.
     */
    public void fatal(String msg) {
        if (!fatal) {
            fatalMessage = msg;
        }
        fatal = true;
        log(LogSeverity.CRITICAL, msg);
    }

    /**
     * Ends the calling test as skipped.
     *
     * @throws SkipTestException always
     */
    public void skipTest(String reason) {
        throw new SkipTestException(reason);
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous artifact with that key.
     *
     * <p>A {@link String} or {@link Path} value is recorded as a file reference. A reference to a missing file
     * produces a warning but is stored all the same.
     */
    public void addArtifact(String key, @Nullable Object value) {
        Objects.requireNonNull(key, "key");
        var artifact = Artifact.of(value);
        if (artifact.isFileReference()) {
            if (isExistingFile(String.valueOf(artifact.value()))) {
                debug("Artifact file '%s' exists.".formatted(artifact.value()));
            } else {
                warn("Artifact file '%s' does NOT exist.".formatted(artifact.value()));
            }
        }
        artifacts.put(key, artifact);
    }

    /** Hook for all logging methods; subclasses may decorate the message before calling super. */
    protected void log(LogSeverity severity, String msg) {
        String message = String.valueOf(msg);
        records.add(new LogRecord(severity, message, Instant.now()));
        logger.log(severity.toLevel(), CONTEXT_MARKER, message);
    }

    /**
     * Appends a record produced elsewhere (ambient logging) without echoing it to the console again.
     */
    public void capture(LogRecord record) {
        records.add(record);
    }

    public List<LogRecord> logs() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public Map<String, Artifact> artifacts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    /** Extra arguments passed to the run, left for the test to parse. */
    public List<String> args() {
        return args;
    }

    public String file() {
        return file;
    }

    public String testName() {
        return testName;
    }

    public boolean isFatal() {
        return fatal;
    }

    public @Nullable String fatalMessage() {
        return fatalMessage;
    }

    /** Time since this context was created. */
    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static boolean isExistingFile(String value) {
        try {
            return Files.isRegularFile(Path.of(value));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
