package dev.microtest.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * An external process whose output is captured line by line while the caller keeps talking to it.
 *
 * <p>Starting a command spawns the process with all three standard streams piped and starts two daemon reader
 * threads, one per output stream. Each reader decodes its stream (malformed input becomes the replacement
 * character), splits it into lines, appends every line to that stream's buffer and to the merged buffer, and then
 * hands it to the optional {@link LineListener}. Lines within a stream keep their arrival order; there is no
 * ordering between the two streams.
 *
 * <p>Use it with try-with-resources. {@link #close()} closes stdin, gives the process a grace period to exit,
 * terminates it (politely, then forcibly) if it is still running, joins both readers and seals the buffers. Output
 * collected so far stays readable after close.
 *
 * <pre>{@code
 * try (var cmd = Command.builder(List.of("/bin/sh")).start()) {
 *     cmd.write("echo hello\n");
 *     ...
 *     List<String> lines = cmd.getStdout();
 * }
 * }</pre>
 */
public final class Command implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(Command.class);

    /** Default time a process gets to exit on its own once stdin is closed; {@code microtest.command.gracePeriodMs}. */
    public static final Duration DEFAULT_GRACE_PERIOD =
            Duration.ofMillis(Long.getLong("microtest.command.gracePeriodMs", 2000L));

    private static final Duration TERMINATE_WAIT = Duration.ofSeconds(1);
    private static final Duration READER_JOIN_TIMEOUT = Duration.ofSeconds(2);

    private final List<String> argv;
    private final @Nullable Path workingDirectory;
    private final Map<String, String> environmentOverrides;
    private final @Nullable LineListener listener;
    private final Duration gracePeriod;
    private final Charset charset;

    private final Process process;
    private final LineBuffer stdout = new LineBuffer();
    private final LineBuffer stderr = new LineBuffer();
    private final LineBuffer merged = new LineBuffer();
    private final Thread stdoutReader;
    private final Thread stderrReader;

    private final Object stdinLock = new Object();
    private final OutputStream stdin;
    private boolean stdinClosed;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile @Nullable Integer exitCode;

    private Command(Builder builder) throws IOException {
        this.argv = List.copyOf(builder.argv);
        this.workingDirectory = builder.workingDirectory;
        this.environmentOverrides = Map.copyOf(builder.environment);
        this.listener = builder.listener;
        this.gracePeriod = builder.gracePeriod;
        this.charset = builder.charset;

        var pb = new ProcessBuilder(argv);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        pb.environment().putAll(environmentOverrides);

        // spawn failures surface here, before any reader exists
        this.process = pb.start();
        this.stdin = process.getOutputStream();
        logger.debug("Started {} (pid={})", argv, process.pid());

        this.stdoutReader = startReader(process.getInputStream(), OutputStreamKind.STDOUT, stdout);
        this.stderrReader = startReader(process.getErrorStream(), OutputStreamKind.STDERR, stderr);
    }

    public static Builder builder(List<String> argv) {
        return new Builder(argv);
    }

    /** Starts {@code argv} with default settings. */
    public static Command start(String... argv) throws IOException {
        return builder(List.of(argv)).start();
    }

    /**
     * Sends {@code text} to the process's standard input and flushes it. No line terminator is added.
     *
     * @throws IOException if stdin has been closed, the process has exited, or the pipe is broken
     */
    public void write(String text) throws IOException {
        Objects.requireNonNull(text, "text");
        synchronized (stdinLock) {
            if (stdinClosed) {
                throw new IOException("stdin of pid " + process.pid() + " is closed");
            }
            if (!process.isAlive()) {
                throw new IOException("process " + process.pid() + " has exited");
            }
            stdin.write(text.getBytes(charset));
            stdin.flush();
        }
    }

    /** Closes the process's standard input, signalling end of input. Further writes fail. */
    public void closeStdin() {
        synchronized (stdinLock) {
            if (stdinClosed) {
                return;
            }
            stdinClosed = true;
            try {
                stdin.close();
            } catch (IOException e) {
                // the process may already have gone away and taken the pipe with it
                logger.debug("Closing stdin of pid {} failed: {}", process.pid(), e.getMessage());
            }
        }
    }

    /** Lines read from stdout so far, in arrival order. */
    public List<String> getStdout() {
        return stdout.snapshot();
    }

    /** Lines read from stderr so far, in arrival order. */
    public List<String> getStderr() {
        return stderr.snapshot();
    }

    /** Lines from both streams in the order the readers appended them. */
    public List<String> getOutput() {
        return merged.snapshot();
    }

    public boolean isRunning() {
        return process.isAlive();
    }

    /** The exit code, once the process has terminated. */
    public OptionalInt exitCode() {
        Integer recorded = exitCode;
        if (recorded != null) {
            return OptionalInt.of(recorded);
        }
        if (process.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(process.exitValue());
    }

    public long pid() {
        return process.pid();
    }

    public List<String> argv() {
        return argv;
    }

    public @Nullable Path workingDirectory() {
        return workingDirectory;
    }

    public Map<String, String> environmentOverrides() {
        return environmentOverrides;
    }

    /**
     * Waits for the process to exit and for both readers to drain what it wrote.
     *
     * @return the exit code
     */
    public int waitFor() throws InterruptedException {
        int code = process.waitFor();
        exitCode = code;
        joinReader(stdoutReader);
        joinReader(stderrReader);
        return code;
    }

    /**
     * Waits at most {@code timeout} for the process to exit, then for the readers to drain.
     *
     * @return true if the process exited within the timeout
     */
    public boolean waitFor(Duration timeout) throws InterruptedException {
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        exitCode = process.exitValue();
        joinReader(stdoutReader);
        joinReader(stderrReader);
        return true;
    }

    /**
     * Tears the process down: closes stdin, waits out the grace period, terminates the process if needed, joins the
     * readers and seals the buffers. Safe to call more than once and on a process that already exited.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeStdin();
        try {
            if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.debug("pid {} still running after {}ms, terminating", process.pid(), gracePeriod.toMillis());
                process.destroy();
                if (!process.waitFor(TERMINATE_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("pid {} ignored termination, killing it", process.pid());
                    process.destroyForcibly();
                    process.waitFor(TERMINATE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
                }
            }
            stopReader(stdoutReader, process.getInputStream());
            stopReader(stderrReader, process.getErrorStream());
        } catch (InterruptedException e) {
            logger.debug("Interrupted while closing pid {}, killing it", process.pid());
            process.destroyForcibly();
            finishAfterInterrupt();
            Thread.currentThread().interrupt();
        } finally {
            stdout.seal();
            stderr.seal();
            merged.seal();
            if (!process.isAlive()) {
                exitCode = process.exitValue();
            }
            logger.debug("Closed {} (pid={}, exit={})", argv, process.pid(), exitCode);
        }
    }

    /** Bounded teardown for an interrupted close: waits for the kill to land and the readers to stop. */
    private void finishAfterInterrupt() {
        long deadline = System.nanoTime() + TERMINATE_WAIT.toNanos();
        while (process.isAlive() && System.nanoTime() < deadline) {
            try {
                process.waitFor(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException again) {
                logger.debug("Interrupted again while waiting for pid {} to die", process.pid());
            }
        }
        stopReaderUninterruptibly(stdoutReader, process.getInputStream());
        stopReaderUninterruptibly(stderrReader, process.getErrorStream());
    }

    private static void stopReaderUninterruptibly(Thread reader, InputStream stream) {
        joinUninterruptibly(reader);
        if (!reader.isAlive()) {
            return;
        }
        try {
            stream.close();
        } catch (IOException e) {
            logger.debug("Closing stream of {} failed: {}", reader.getName(), e.getMessage());
        }
        reader.interrupt();
        joinUninterruptibly(reader);
        if (reader.isAlive()) {
            logger.warn("Reader {} did not stop; its buffer is sealed", reader.getName());
        }
    }

    private static void joinUninterruptibly(Thread reader) {
        long deadline = System.nanoTime() + READER_JOIN_TIMEOUT.toNanos();
        while (reader.isAlive() && System.nanoTime() < deadline) {
            try {
                TimeUnit.NANOSECONDS.timedJoin(reader, deadline - System.nanoTime());
            } catch (InterruptedException again) {
                logger.debug("Interrupted again while joining {}", reader.getName());
            }
        }
    }

    private Thread startReader(InputStream in, OutputStreamKind kind, LineBuffer buffer) {
        var thread = new Thread(
                () -> drain(in, kind, buffer),
                "command-" + kind.name().toLowerCase(Locale.ROOT) + "-" + process.pid());
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void drain(InputStream in, OutputStreamKind kind, LineBuffer buffer) {
        var decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        // readLine hands back an unterminated last line at EOF as well
        try (var reader = new BufferedReader(new InputStreamReader(in, decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!buffer.append(line)) {
                    break;
                }
                merged.append(line);
                notifyListener(kind, line);
            }
        } catch (IOException e) {
            if (!closed.get()) {
                logger.debug("Reading {} of pid {} stopped: {}", kind, process.pid(), e.getMessage());
            }
        }
    }

    private void notifyListener(OutputStreamKind kind, String line) {
        if (listener == null) {
            return;
        }
        try {
            listener.onLine(kind, line);
        } catch (RuntimeException e) {
            logger.warn("Line listener failed on {} of pid {}", kind, process.pid(), e);
        }
    }

    private static void joinReader(Thread reader) throws InterruptedException {
        reader.join(READER_JOIN_TIMEOUT.toMillis());
    }

    private void stopReader(Thread reader, InputStream stream) throws InterruptedException {
        joinReader(reader);
        if (!reader.isAlive()) {
            return;
        }
        // a grandchild may still hold the pipe open; cut the reader loose
        logger.debug("Reader {} still running after process exit, closing its stream", reader.getName());
        try {
            stream.close();
        } catch (IOException e) {
            logger.debug("Closing stream of {} failed: {}", reader.getName(), e.getMessage());
        }
        reader.interrupt();
        joinReader(reader);
        if (reader.isAlive()) {
            logger.warn("Reader {} did not stop; its buffer is sealed", reader.getName());
        }
    }

    @Override
    public String toString() {
        return "Command" + argv + " (pid=" + process.pid() + ")";
    }

    public static final class Builder {
        private final List<String> argv;
        private @Nullable Path workingDirectory;
        private Map<String, String> environment = Map.of();
        private @Nullable LineListener listener;
        private Duration gracePeriod = DEFAULT_GRACE_PERIOD;
        private Charset charset = StandardCharsets.UTF_8;

        private Builder(List<String> argv) {
            Objects.requireNonNull(argv, "argv");
            if (argv.isEmpty()) {
                throw new IllegalArgumentException("argv must not be empty");
            }
            this.argv = new ArrayList<>(argv);
        }

        public Builder workingDirectory(@Nullable Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        /** Variables set on top of the inherited environment. */
        public Builder environment(Map<String, String> overrides) {
            this.environment = Map.copyOf(overrides);
            return this;
        }

        public Builder listener(@Nullable LineListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder gracePeriod(Duration gracePeriod) {
            if (gracePeriod.isNegative()) {
                throw new IllegalArgumentException("gracePeriod must not be negative");
            }
            this.gracePeriod = gracePeriod;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        /**
         * Spawns the process.
         *
         * @throws IOException if the process cannot be started (executable missing, not permitted, bad directory)
         */
        public Command start() throws IOException {
            return new Command(this);
        }
    }
}
