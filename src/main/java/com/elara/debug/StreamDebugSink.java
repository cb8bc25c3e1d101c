package com.elara.debug;

import java.io.PrintStream;

/** Writes entries at or above a minimum level to a stream, one line each. */
public final class StreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public StreamDebugSink(PrintStream out, DebugLevel minLevel) {
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.TRACE : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}
