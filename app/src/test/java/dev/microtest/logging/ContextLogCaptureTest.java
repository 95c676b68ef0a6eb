package dev.microtest.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.microtest.context.LogRecord;
import dev.microtest.context.LogSeverity;
import dev.microtest.context.TestContext;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.junit.jupiter.api.Test;

public class ContextLogCaptureTest {
    private static final Logger ambient = LogManager.getLogger("dev.microtest.ambient");

    private static TestContext newContext() {
        return new TestContext("TestX.java", "testY", List.of());
    }

    @Test
    void ambientEventsGoToBoundContext() {
        var ctx = newContext();
        try (var capture = ContextLogCapture.install();
                var binding = capture.bind(ctx)) {
            ambient.debug("value is {}", 42);
            ambient.warn("careful");
        }

        var logs = ctx.logs();
        assertEquals(List.of("value is 42", "careful"), logs.stream().map(LogRecord::message).toList());
        assertEquals(List.of(LogSeverity.DEBUG, LogSeverity.WARNING), logs.stream().map(LogRecord::severity).toList());
    }

    @Test
    void contextCallsAreNotRecordedTwice() {
        var ctx = newContext();
        try (var capture = ContextLogCapture.install();
                var binding = capture.bind(ctx)) {
            ctx.info("direct");
        }

        assertEquals(1, ctx.logs().size());
    }

    @Test
    void eventsOutsideBindingAreIgnored() {
        var ctx = newContext();
        try (var capture = ContextLogCapture.install()) {
            ambient.info("before");
            try (var binding = capture.bind(ctx)) {
                ambient.info("during");
            }
            ambient.info("after");
        }

        assertEquals(List.of("during"), ctx.logs().stream().map(LogRecord::message).toList());
    }

    @Test
    void eventsFromOtherThreadsAreCaptured() throws InterruptedException {
        var ctx = newContext();
        try (var capture = ContextLogCapture.install();
                var binding = capture.bind(ctx)) {
            var thread = new Thread(() -> ambient.error("from worker"));
            thread.start();
            thread.join();
        }

        var record = ctx.logs().get(0);
        assertEquals("from worker", record.message());
        assertTrue(record.severity().isError());
    }

    @Test
    void thrownExceptionIsAppendedToMessage() {
        var ctx = newContext();
        try (var capture = ContextLogCapture.install();
                var binding = capture.bind(ctx)) {
            ambient.error("broken", new IllegalStateException("bad state"));
        }

        assertTrue(ctx.logs().get(0).message().contains("bad state"));
    }

    @Test
    void nestedCaptureDoesNotDetachOuterOne() {
        var outerCtx = newContext();
        var innerCtx = new TestContext("TestInner.java", "testInner", List.of());
        try (var outer = ContextLogCapture.install();
                var outerBinding = outer.bind(outerCtx)) {
            try (var inner = ContextLogCapture.install();
                    var innerBinding = inner.bind(innerCtx)) {
                ambient.info("inside inner run");
            }
            ambient.warn("after inner run");
        }

        assertEquals(List.of("inside inner run"), innerCtx.logs().stream().map(LogRecord::message).toList());
        assertEquals(List.of("after inner run"), outerCtx.logs().stream().map(LogRecord::message).toList());
    }

    @Test
    void capturesHaveDistinctAppenderNames() {
        try (var first = ContextLogCapture.install();
                var second = ContextLogCapture.install()) {
            assertNotEquals(first.getName(), second.getName());
            var root = LoggerContext.getContext(false).getConfiguration().getRootLogger();
            assertTrue(root.getAppenders().containsKey(first.getName()));
            assertTrue(root.getAppenders().containsKey(second.getName()));
        }
    }

    @Test
    void closeDetachesFromRootLogger() {
        var capture = ContextLogCapture.install();
        var root = LoggerContext.getContext(false).getConfiguration().getRootLogger();
        assertTrue(root.getAppenders().containsKey(capture.getName()));

        capture.close();

        assertFalse(root.getAppenders().containsKey(capture.getName()));
    }
}
