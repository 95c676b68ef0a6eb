package dev.microtest.engine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Why a test failed.
 *
 * @param message the raised message, or the exception's simple name when it had none
 * @param location the frame the failure originated from, e.g. {@code com.acme.DemoTest.testX(DemoTest.java:12)}
 * @param exceptionType fully qualified name of the raised type; null for failures that were not raised
 * @param stackTrace printed stack trace, or compiler diagnostics for load failures
 */
public record FailureDetail(
        String message, String location, @Nullable String exceptionType, @Nullable String stackTrace) {

    /**
     * Describes {@code error}, locating it at the first frame inside {@code testClassName} (or one of its nested
     * classes) when there is one, otherwise at the top frame.
     */
    public static FailureDetail from(Throwable error, @Nullable String testClassName) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new FailureDetail(message, locate(error, testClassName), error.getClass().getName(), printed(error));
    }

    /** Failure reported through the context's {@code fatal} call rather than by raising. */
    public static FailureDetail fatal(@Nullable String message, String location) {
        return new FailureDetail(message == null ? "fatal" : message, location, null, null);
    }

    private static String locate(Throwable error, @Nullable String testClassName) {
        StackTraceElement[] frames = error.getStackTrace();
        if (frames.length == 0) {
            return "<unknown>";
        }
        if (testClassName != null) {
            var inTest = Arrays.stream(frames)
                    .filter(f -> f.getClassName().equals(testClassName)
                            || f.getClassName().startsWith(testClassName + "$"))
                    .findFirst();
            if (inTest.isPresent()) {
                return inTest.get().toString();
            }
        }
        return frames[0].toString();
    }

    private static String printed(Throwable error) {
        var out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
