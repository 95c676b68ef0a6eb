package dev.microtest.logging;

import dev.microtest.context.LogRecord;
import dev.microtest.context.LogSeverity;
import dev.microtest.context.TestContext;
import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Property;
import org.jetbrains.annotations.Nullable;

/**
 * Routes ambient Log4j events into the context of the test that is currently running.
 *
 * <p>The appender is attached to the root logger for one engine run and detached when the run ends. Between those
 * points a context is bound around each test invocation with {@link #bind(TestContext)}; events arriving while no
 * context is bound are ignored. Events emitted by {@link TestContext} itself carry
 * {@link TestContext#CONTEXT_MARKER} and are skipped because the context already recorded them.
 *
 * <p>Captures nest: a test may run an engine of its own. Each capture is registered under its own appender name,
 * and only the most recently installed capture that is still open records events, so an inner run neither leaks
 * into the outer test's context nor detaches the outer capture when it closes.
 *
 * <pre>{@code
 * try (var capture = ContextLogCapture.install()) {
 *     for (var unit : units) {
 *         try (var binding = capture.bind(ctx)) {
 *             invoke(unit, ctx);
 *         }
 *     }
 * }
 * }</pre>
 */
public final class ContextLogCapture extends AbstractAppender implements AutoCloseable {
    private static final String APPENDER_NAME = "MicrotestContextCapture";
    private static final AtomicInteger instanceCounter = new AtomicInteger();
    private static final Deque<ContextLogCapture> active = new ConcurrentLinkedDeque<>();

    private final AtomicReference<TestContext> current = new AtomicReference<>();
    private final LoggerContext loggerContext;

    private ContextLogCapture(LoggerContext loggerContext) {
        super(APPENDER_NAME + "-" + instanceCounter.incrementAndGet(), null, null, true, Property.EMPTY_ARRAY);
        this.loggerContext = loggerContext;
    }

    /** Creates the appender and attaches it to the root logger of the active logger context. */
    public static ContextLogCapture install() {
        var loggerContext = LoggerContext.getContext(false);
        var capture = new ContextLogCapture(loggerContext);
        capture.start();

        Configuration config = loggerContext.getConfiguration();
        config.getRootLogger().addAppender(capture, Level.ALL, null);
        loggerContext.updateLoggers();
        active.push(capture);
        return capture;
    }

    /**
     * Makes {@code context} the receiver of ambient events until the returned binding is closed.
     */
    public Binding bind(TestContext context) {
        @Nullable TestContext previous = current.getAndSet(context);
        return () -> current.compareAndSet(context, previous);
    }

    @Override
    public void append(LogEvent event) {
        @Nullable TestContext target = current.get();
        if (target == null || active.peekFirst() != this) {
            return;
        }
        var marker = event.getMarker();
        if (marker != null && marker.isInstanceOf(TestContext.CONTEXT_MARKER)) {
            return;
        }
        // events may be reused by the logging framework, so copy what we need now
        String message = event.getMessage() == null ? "" : event.getMessage().getFormattedMessage();
        if (event.getThrown() != null) {
            message = message + " (" + event.getThrown() + ")";
        }
        target.capture(new LogRecord(
                LogSeverity.fromLevel(event.getLevel()), message, Instant.ofEpochMilli(event.getTimeMillis())));
    }

    /** Detaches the appender from the root logger. */
    @Override
    public void close() {
        current.set(null);
        active.remove(this);
        Configuration config = loggerContext.getConfiguration();
        config.getRootLogger().removeAppender(getName());
        loggerContext.updateLoggers();
        stop();
    }

    /** Scope of one bound context. */
    @FunctionalInterface
    public interface Binding extends AutoCloseable {
        @Override
        void close();
    }
}
