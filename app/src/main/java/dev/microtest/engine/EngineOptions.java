package dev.microtest.engine;

import dev.microtest.context.ContextFactory;
import dev.microtest.store.DurationStore;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for a {@link TestEngine}.
 *
 * @param showEstimates log time estimates from the duration store before the run and before each test
 * @param storeFileName name of the duration store file inside the test root
 * @param tags if non-empty, only tests carrying at least one of these tags run
 * @param excludeTags tests carrying any of these tags do not run
 * @param contextFactory creates the context of each test
 * @param extraClasspath entries added to the classpath test files are compiled and loaded with
 */
public record EngineOptions(
        boolean showEstimates,
        String storeFileName,
        Set<String> tags,
        Set<String> excludeTags,
        ContextFactory contextFactory,
        List<Path> extraClasspath) {

    public EngineOptions {
        Objects.requireNonNull(storeFileName, "storeFileName");
        Objects.requireNonNull(contextFactory, "contextFactory");
        if (storeFileName.isBlank()) {
            throw new IllegalArgumentException("storeFileName must not be blank");
        }
        tags = Set.copyOf(tags);
        excludeTags = Set.copyOf(excludeTags);
        extraClasspath = List.copyOf(extraClasspath);
    }

    public static EngineOptions defaults() {
        return new EngineOptions(true, DurationStore.DEFAULT_FILE_NAME, Set.of(), Set.of(), ContextFactory.DEFAULT, List.of());
    }

    /**
     * Defaults overridden by the {@code microtest.storeFile} and {@code microtest.showEstimates} system properties.
     */
    public static EngineOptions fromSystemProperties() {
        var options = defaults();
        String storeFile = System.getProperty("microtest.storeFile");
        if (storeFile != null && !storeFile.isBlank()) {
            options = options.withStoreFileName(storeFile);
        }
        String showEstimates = System.getProperty("microtest.showEstimates");
        if (showEstimates != null) {
            options = options.withShowEstimates(Boolean.parseBoolean(showEstimates));
        }
        return options;
    }

    public EngineOptions withShowEstimates(boolean showEstimates) {
        return new EngineOptions(showEstimates, storeFileName, tags, excludeTags, contextFactory, extraClasspath);
    }

    public EngineOptions withStoreFileName(String storeFileName) {
        return new EngineOptions(showEstimates, storeFileName, tags, excludeTags, contextFactory, extraClasspath);
    }

    public EngineOptions withTags(Set<String> tags) {
        return new EngineOptions(showEstimates, storeFileName, tags, excludeTags, contextFactory, extraClasspath);
    }

    public EngineOptions withExcludeTags(Set<String> excludeTags) {
        return new EngineOptions(showEstimates, storeFileName, tags, excludeTags, contextFactory, extraClasspath);
    }

    public EngineOptions withContextFactory(ContextFactory contextFactory) {
        return new EngineOptions(showEstimates, storeFileName, tags, excludeTags, contextFactory, extraClasspath);
    }

    public EngineOptions withExtraClasspath(List<Path> extraClasspath) {
        return new EngineOptions(showEstimates, storeFileName, tags, excludeTags, contextFactory, extraClasspath);
    }

    boolean selects(TestUnit unit) {
        if (!tags.isEmpty() && unit.tags().stream().noneMatch(tags::contains)) {
            return false;
        }
        return unit.tags().stream().noneMatch(excludeTags::contains);
    }
}
