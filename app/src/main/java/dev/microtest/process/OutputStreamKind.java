package dev.microtest.process;

/** Which output stream of a child process a line came from. */
public enum OutputStreamKind {
    STDOUT,
    STDERR
}
