package dev.microtest.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CommandTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @BeforeEach
    void requirePosixShell() {
        Assumptions.assumeFalse(
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"),
                "process tests drive /bin/sh");
    }

    private static void awaitLine(Supplier<List<String>> lines, String expected) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (System.nanoTime() < deadline) {
            if (lines.get().contains(expected)) {
                return;
            }
            Thread.sleep(20);
        }
        fail("Timed out waiting for '" + expected + "', got " + lines.get());
    }

    @Test
    void interactiveShellAnswersWhileRunning() throws Exception {
        try (var cmd = Command.start("/bin/sh")) {
            assertTrue(cmd.isRunning());

            cmd.write("echo hello\n");
            awaitLine(cmd::getStdout, "hello");

            cmd.write("echo oops 1>&2\n");
            awaitLine(cmd::getStderr, "oops");

            cmd.write("echo again\n");
            awaitLine(cmd::getStdout, "again");
            assertEquals(List.of("hello", "again"), cmd.getStdout());
            assertTrue(cmd.isRunning());
        }
    }

    @Test
    void closeStopsProcessAndRejectsWrites() throws Exception {
        var cmd = Command.start("/bin/sh");
        cmd.write("echo before\n");
        awaitLine(cmd::getStdout, "before");

        cmd.close();

        assertFalse(cmd.isRunning());
        assertTrue(cmd.exitCode().isPresent());
        assertThrows(IOException.class, () -> cmd.write("echo after\n"));
        // output stays readable and no longer changes
        assertEquals(List.of("before"), cmd.getStdout());
        cmd.close();
        assertEquals(List.of("before"), cmd.getStdout());
    }

    @Test
    void closeTerminatesProcessIgnoringStdin() throws Exception {
        var cmd = Command.builder(List.of("sleep", "30"))
                .gracePeriod(Duration.ofMillis(100))
                .start();
        long start = System.nanoTime();

        cmd.close();

        assertFalse(cmd.isRunning());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(TIMEOUT) < 0);
    }

    @Test
    void collectsEveryLineOfBothStreams() throws Exception {
        try (var cmd = Command.start(
                "/bin/sh", "-c", "for i in 1 2 3 4 5; do echo out$i; done; for i in 1 2 3; do echo err$i 1>&2; done")) {
            assertTrue(cmd.waitFor(TIMEOUT));

            assertEquals(List.of("out1", "out2", "out3", "out4", "out5"), cmd.getStdout());
            assertEquals(List.of("err1", "err2", "err3"), cmd.getStderr());
            assertEquals(8, cmd.getOutput().size());
            assertEquals(0, cmd.exitCode().getAsInt());
        }
    }

    @Test
    void unterminatedLastLineIsKept() throws Exception {
        try (var cmd = Command.start("/bin/sh", "-c", "printf 'first\\nlast'")) {
            cmd.waitFor();
            assertEquals(List.of("first", "last"), cmd.getStdout());
        }
    }

    @Test
    void invalidBytesAreReplaced() throws Exception {
        try (var cmd = Command.start("/bin/sh", "-c", "printf 'a\\377b\\nnext\\n'")) {
            cmd.waitFor();
            assertEquals(List.of("a\uFFFDb", "next"), cmd.getStdout());
        }
    }

    @Test
    void interruptedCloseStillTearsDown() throws Exception {
        var cmd = Command.builder(List.of("sleep", "30"))
                .gracePeriod(Duration.ofSeconds(5))
                .start();
        Thread.currentThread().interrupt();
        try {
            cmd.close();

            assertFalse(cmd.isRunning());
            assertTrue(cmd.exitCode().isPresent());
        } finally {
            // close restores the interrupt status it swallowed
            assertTrue(Thread.interrupted());
        }
    }

    @Test
    void exitCodeIsReported() throws Exception {
        try (var cmd = Command.start("/bin/sh", "-c", "exit 3")) {
            assertEquals(3, cmd.waitFor());
            assertEquals(3, cmd.exitCode().getAsInt());
        }
    }

    @Test
    void listenerSeesLinesWithTheirStream() throws Exception {
        var seen = new CopyOnWriteArrayList<String>();
        try (var cmd = Command.builder(List.of("/bin/sh", "-c", "echo a; echo b 1>&2"))
                .listener((stream, line) -> seen.add(stream + ":" + line))
                .start()) {
            cmd.waitFor();
        }
        assertEquals(2, seen.size());
        assertTrue(seen.contains("STDOUT:a"));
        assertTrue(seen.contains("STDERR:b"));
    }

    @Test
    void throwingListenerDoesNotStopReading() throws Exception {
        try (var cmd = Command.builder(List.of("/bin/sh", "-c", "echo one; echo two"))
                .listener((stream, line) -> {
                    throw new IllegalStateException("listener broke on " + line);
                })
                .start()) {
            cmd.waitFor();
            assertEquals(List.of("one", "two"), cmd.getStdout());
        }
    }

    @Test
    void environmentOverridesAreVisible() throws Exception {
        try (var cmd = Command.builder(List.of("/bin/sh", "-c", "echo \"$MICROTEST_GREETING\""))
                .environment(Map.of("MICROTEST_GREETING", "hi there"))
                .start()) {
            cmd.waitFor();
            assertEquals(List.of("hi there"), cmd.getStdout());
        }
    }

    @Test
    void runsInWorkingDirectory(@TempDir Path tempDir) throws Exception {
        try (var cmd = Command.builder(List.of("/bin/sh", "-c", "pwd -P"))
                .workingDirectory(tempDir)
                .start()) {
            cmd.waitFor();
            assertEquals(List.of(tempDir.toRealPath().toString()), cmd.getStdout());
        }
    }

    @Test
    void spawnFailureThrowsImmediately() {
        assertThrows(IOException.class, () -> Command.start("/definitely/not/a/real/binary"));
    }

    @Test
    void emptyArgvIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Command.builder(List.of()));
    }

    @Test
    void closeStdinEndsInteractiveSession() throws Exception {
        try (var cmd = Command.start("/bin/sh")) {
            cmd.write("echo last\n");
            cmd.closeStdin();

            assertTrue(cmd.waitFor(TIMEOUT));
            assertEquals(List.of("last"), cmd.getStdout());
            assertThrows(IOException.class, () -> cmd.write("echo more\n"));
        }
    }
}
