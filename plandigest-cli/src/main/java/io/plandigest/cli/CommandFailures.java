package io.plandigest.cli;

final class CommandFailures {
    static final int FAILURE = 1;
    static final int USAGE = 2;

    private CommandFailures() {
    }

    /** Prints {@code prefix: message} to stderr; invalid input maps to the usage exit code. */
    static int report(String prefix, Exception e) {
        System.err.println(prefix + ": " + e.getMessage());
        return e instanceof IllegalArgumentException ? USAGE : FAILURE;
    }
}
