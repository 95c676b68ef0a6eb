package dev.microtest.engine;

import dev.microtest.context.LogRecord;
import dev.microtest.context.LogSeverity;
import java.util.List;

/**
 * Counters over a set of results: outcomes, warnings and errors logged, and total time.
 */
public record TestStats(int passed, int failed, int skipped, int warnings, int errors, double totalSeconds) {

    public static TestStats from(List<TestResult> results) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int warnings = 0;
        int errors = 0;
        double total = 0;
        for (var result : results) {
            switch (result.status()) {
                case PASS -> passed++;
                case FAIL -> failed++;
                case SKIP -> skipped++;
            }
            for (LogRecord record : result.logs()) {
                if (record.severity() == LogSeverity.WARNING) {
                    warnings++;
                } else if (record.severity().isError()) {
                    errors++;
                }
            }
            total += result.durationSeconds();
        }
        return new TestStats(passed, failed, skipped, warnings, errors, total);
    }

    public int total() {
        return passed + failed + skipped;
    }

    /** Whole-number percentage of passed tests; 0 when there were none. */
    public int passPercent() {
        return total() == 0 ? 0 : (int) ((passed * 100L) / total());
    }
}
