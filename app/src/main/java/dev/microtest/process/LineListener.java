package dev.microtest.process;

/**
 * Receives each line a {@link Command} reads, on the reader thread of the stream it came from.
 *
 * <p>Implementations must return promptly: while a listener blocks, its stream is not drained and the child may
 * stall once the pipe buffer fills. The other stream keeps flowing.
 */
@FunctionalInterface
public interface LineListener {
    void onLine(OutputStreamKind stream, String line);
}
