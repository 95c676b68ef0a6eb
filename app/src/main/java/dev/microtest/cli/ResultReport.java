package dev.microtest.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.microtest.context.LogRecord;
import dev.microtest.engine.TestResult;
import dev.microtest.engine.TestStats;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Renders a finished run for the terminal, and as JSON for other tools. */
final class ResultReport {
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final List<TestResult> results;
    private final TestStats stats;

    ResultReport(List<TestResult> results) {
        this.results = List.copyOf(results);
        this.stats = TestStats.from(results);
    }

    TestStats stats() {
        return stats;
    }

    /** One line: pass percentage and ratio, then warning and error counts or a clean bill. */
    String quietSummary() {
        var problems = new ArrayList<String>();
        if (stats.warnings() > 0) {
            problems.add(stats.warnings() + " warnings");
        }
        if (stats.errors() > 0) {
            problems.add(stats.errors() + " errors");
        }
        if (problems.isEmpty()) {
            problems.add("All perfect :)");
        }
        return "Tests: %d%% passed (%d/%d) - %s"
                .formatted(stats.passPercent(), stats.passed(), stats.total(), String.join(", ", problems));
    }

    void printQuiet(PrintWriter out) {
        out.println(quietSummary());
        out.flush();
    }

    void printReport(PrintWriter out, boolean verbose) {
        out.println();
        out.println("Report");
        out.println("======");
        for (var result : results) {
            out.println(reportLine(result));
            if (result.failure() != null) {
                out.println("  " + result.failure().message() + " at " + result.failure().location());
            } else if (result.skipped() && result.skipReason() != null) {
                out.println("  skipped: " + result.skipReason());
            }
            if (verbose) {
                for (LogRecord record : result.logs()) {
                    out.println("  " + record.severity() + " " + record.message());
                }
                if (!result.artifacts().isEmpty()) {
                    out.println("  Artifacts: " + describeArtifacts(result));
                }
                out.println();
            }
        }
        out.println(String.format(
                Locale.ROOT,
                "%d passed, %d failed, %d skipped in %.3fs (%d warnings, %d errors)",
                stats.passed(),
                stats.failed(),
                stats.skipped(),
                stats.totalSeconds(),
                stats.warnings(),
                stats.errors()));
        out.flush();
    }

    static String reportLine(TestResult result) {
        return String.format(
                Locale.ROOT, "%-50s - %s in %.3fs", result.key(), result.status().name(), result.durationSeconds());
    }

    private static String describeArtifacts(TestResult result) {
        var parts = new ArrayList<String>();
        result.artifacts()
                .forEach((key, artifact) ->
                        parts.add(key + "=" + artifact.type().name().toLowerCase(Locale.ROOT) + ":" + artifact.value()));
        return String.join(", ", parts);
    }

    void writeJson(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), results);
    }

    static String toJson(List<TestResult> results) throws IOException {
        return objectMapper.writeValueAsString(results);
    }
}
