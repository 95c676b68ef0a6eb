package dev.microtest.engine;

import org.jetbrains.annotations.Nullable;

/** Result of one guarded test invocation, before timing and captured output are attached. */
public sealed interface Outcome permits Outcome.Passed, Outcome.Failed, Outcome.Skipped {

    TestStatus status();

    record Passed() implements Outcome {
        @Override
        public TestStatus status() {
            return TestStatus.PASS;
        }
    }

    record Failed(FailureDetail detail) implements Outcome {
        @Override
        public TestStatus status() {
            return TestStatus.FAIL;
        }
    }

    record Skipped(@Nullable String reason) implements Outcome {
        @Override
        public TestStatus status() {
            return TestStatus.SKIP;
        }
    }
}
