package dev.microtest.context;

import org.apache.logging.log4j.Level;

/** Severity of a captured log record, named the way the report prints them. */
public enum LogSeverity {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /** Maps a Log4j level onto a severity; TRACE and finer collapse into DEBUG. */
    public static LogSeverity fromLevel(Level level) {
        if (level.isMoreSpecificThan(Level.FATAL)) {
            return CRITICAL;
        }
        if (level.isMoreSpecificThan(Level.ERROR)) {
            return ERROR;
        }
        if (level.isMoreSpecificThan(Level.WARN)) {
            return WARNING;
        }
        if (level.isMoreSpecificThan(Level.INFO)) {
            return INFO;
        }
        return DEBUG;
    }

    public Level toLevel() {
        return switch (this) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR -> Level.ERROR;
            case CRITICAL -> Level.FATAL;
        };
    }

    /** True for ERROR and CRITICAL, which the summary counts as errors. */
    public boolean isError() {
        return this == ERROR || this == CRITICAL;
    }
}
