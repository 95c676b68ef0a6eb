package dev.microtest.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.microtest.context.Artifact;
import dev.microtest.context.LogRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * What the engine reports for one test.
 *
 * @param file the test file, relative to the root
 * @param test the test name, or {@link #LOAD_FAILURE_NAME} when the file itself could not be loaded
 * @param status pass, fail or skip
 * @param logs captured log records in emission order
 * @param artifacts recorded artifacts by key
 * @param durationSeconds elapsed wall time of the invocation
 * @param failure present exactly when the status is {@link TestStatus#FAIL}
 * @param skipReason the reason given when the test skipped itself
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestResult(
        String file,
        String test,
        TestStatus status,
        List<LogRecord> logs,
        Map<String, Artifact> artifacts,
        @JsonProperty("duration_s") double durationSeconds,
        @Nullable FailureDetail failure,
        @Nullable String skipReason) {

    public static final String LOAD_FAILURE_NAME = "<load>";

    public TestResult {
        logs = List.copyOf(logs);
        artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
        if ((status == TestStatus.FAIL) != (failure != null)) {
            throw new IllegalArgumentException("failure detail must be present exactly for failed tests");
        }
    }

    /** Synthetic result standing in for a test file that failed to compile or initialize. */
    public static TestResult loadFailure(String file, FailureDetail detail) {
        return new TestResult(file, LOAD_FAILURE_NAME, TestStatus.FAIL, List.of(), Map.of(), 0.0, detail, null);
    }

    public String key() {
        return file + "::" + test;
    }

    public boolean passed() {
        return status == TestStatus.PASS;
    }

    public boolean failed() {
        return status == TestStatus.FAIL;
    }

    public boolean skipped() {
        return status == TestStatus.SKIP;
    }
}
