package com.soorj.debug;

/** Pluggable debug output target (stderr, a test buffer, a file, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
