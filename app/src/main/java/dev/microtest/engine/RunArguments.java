package dev.microtest.engine;

import java.util.List;

/**
 * Process-wide view of the extra arguments of the run in progress, for tests that parse their own options. The
 * engine does not interpret them. Empty outside a run.
 */
public final class RunArguments {
    private static volatile List<String> current = List.of();

    private RunArguments() {}

    public static List<String> current() {
        return current;
    }

    static List<String> set(List<String> args) {
        List<String> previous = current;
        current = List.copyOf(args);
        return previous;
    }
}
