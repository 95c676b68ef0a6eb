package dev.microtest.context;

import java.time.Instant;
import java.util.Objects;

/**
 * One log line captured while a test ran.
 *
 * @param severity the severity it was emitted with
 * @param message the formatted message
 * @param timestamp wall-clock time of emission
 */
public record LogRecord(LogSeverity severity, String message, Instant timestamp) {
    public LogRecord {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
