package com.hiolang.debug;

import java.io.PrintStream;

/**
 * Writes debug records as single lines to a PrintStream (stderr for the CLI).
 * Records below the configured threshold are dropped.
 */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel threshold;

    public ConsoleDebugSink(PrintStream out, DebugLevel threshold) {
        this.out = out;
        this.threshold = (threshold == null) ? DebugLevel.DEBUG : threshold;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        synchronized (out) {
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
