package dev.microtest.engine;

import dev.microtest.store.DurationStore;
import java.util.Set;

/**
 * One discovered test: a {@code test*} method of a test file's top-level class.
 *
 * @param file path of the source file relative to the test root, with {@code /} separators
 * @param name the method name
 * @param className binary name of the class declaring it
 * @param wantsContext whether the method declares a parameter to receive the context
 * @param tags labels from {@link dev.microtest.context.Tags}
 */
public record TestUnit(String file, String name, String className, boolean wantsContext, Set<String> tags) {
    public TestUnit {
        tags = Set.copyOf(tags);
    }

    /** Stable identity used for duration estimates. */
    public String key() {
        return DurationStore.key(file, name);
    }

    boolean matches(String pattern) {
        return file.contains(pattern) || name.contains(pattern);
    }
}
