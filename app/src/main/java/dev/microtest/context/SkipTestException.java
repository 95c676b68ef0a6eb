package dev.microtest.context;

/**
 * Thrown by a test to end itself as skipped. The engine reports such a test as {@code skip}, never as a failure.
 */
public class SkipTestException extends RuntimeException {
    public SkipTestException(String reason) {
        super(reason);
    }
}
