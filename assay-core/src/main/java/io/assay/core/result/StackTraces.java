package io.assay.core.result;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/// Stack trace helpers for failure reporting.
///
/// Engine and reflection frames are dropped from the rendered trace so that a
/// result only shows the frames a test author can act on.
public final class StackTraces {

    private static final String[] HIDDEN_FRAME_PREFIXES = {
        "io.assay.core.", "java.lang.reflect.", "jdk.internal.reflect.", "sun.reflect."
    };

    private StackTraces() {}

    /// Unwraps reflection and concurrency wrappers to the throwable raised by user code.
    ///
    /// @param error throwable as caught by the engine, not null
    /// @return the innermost meaningful throwable, never null
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof InvocationTargetException
                        || current instanceof ExecutionException
                        || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /// Renders the throwable and its cause chain without engine frames.
    ///
    /// @param error throwable to describe, not null
    /// @return multi-line stack description, never null
    public static String describe(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        boolean first = true;
        while (current != null) {
            if (!first) {
                sb.append("Caused by: ");
            }
            sb.append(current).append(System.lineSeparator());
            for (StackTraceElement frame : current.getStackTrace()) {
                if (isHidden(frame)) {
                    continue;
                }
                sb.append("    at ").append(frame).append(System.lineSeparator());
            }
            current = current.getCause() == current ? null : current.getCause();
            first = false;
        }
        return sb.toString().stripTrailing();
    }

    /// Finds the innermost frame of `error` declared by `className` or one of its nested classes.
    ///
    /// @param error throwable to inspect, not null
    /// @param className owning test class, may be null
    /// @return the matching frame, or null if none matches
    public static StackTraceElement locate(Throwable error, String className) {
        if (className == null) {
            return null;
        }
        for (StackTraceElement frame : error.getStackTrace()) {
            String declaring = frame.getClassName();
            if (declaring.equals(className) || declaring.startsWith(className + "$")) {
                return frame;
            }
        }
        return null;
    }

    /// Formats `error` as `Type: message`, the way failure messages quote exceptions.
    ///
    /// @param error throwable to format, not null
    /// @return formatted text, never null
    public static String formatMessage(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getName()
                : error.getClass().getName() + ": " + message;
    }

    private static boolean isHidden(StackTraceElement frame) {
        for (String prefix : HIDDEN_FRAME_PREFIXES) {
            if (frame.getClassName().startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
