package dev.microtest.process;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only list of output lines with snapshot reads.
 *
 * <p>Appends and snapshots share one short critical section, so a reader sees every line either completely or not
 * at all. Once {@link #seal()} is called further appends are dropped.
 */
final class LineBuffer {
    private final List<String> lines = new ArrayList<>();
    private boolean sealed;

    /** @return false if the buffer was already sealed and the line was dropped */
    synchronized boolean append(String line) {
        if (sealed) {
            return false;
        }
        lines.add(line);
        return true;
    }

    synchronized List<String> snapshot() {
        return List.copyOf(lines);
    }

    synchronized int size() {
        return lines.size();
    }

    synchronized void seal() {
        sealed = true;
    }
}
