package dev.microtest.context;

import java.util.List;

/**
 * Creates the context handed to each test. Embedders supply their own factory to give tests a {@link TestContext}
 * subclass with extra helpers.
 */
@FunctionalInterface
public interface ContextFactory {
    ContextFactory DEFAULT = TestContext::new;

    TestContext create(String file, String testName, List<String> args);
}
