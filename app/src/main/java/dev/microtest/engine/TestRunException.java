package dev.microtest.engine;

/**
 * The run as a whole could not take place, as opposed to individual tests failing. Thrown for a missing root, an
 * unavailable compiler or an unreadable test tree.
 */
public class TestRunException extends Exception {
    public TestRunException(String message) {
        super(message);
    }

    public TestRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
