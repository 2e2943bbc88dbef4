package com.openforge.taskcore.repair;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Failure reported by a template execution. Every field may be null; executors that run
 * outside the JVM report their own error names (e.g. {@code TypeError}, {@code AxiosError}).
 */
public record ExecutionError(String name, String message, String stack) {

    public static ExecutionError empty() {
        return new ExecutionError(null, null, null);
    }

    public static ExecutionError from(Throwable t) {
        if (t == null) return empty();
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return new ExecutionError(t.getClass().getSimpleName(), t.getMessage(), sw.toString());
    }

    public String nameOrEmpty() {
        return name == null ? "" : name;
    }

    public String messageOrEmpty() {
        return message == null ? "" : message;
    }

    public String stackOrEmpty() {
        return stack == null ? "" : stack;
    }
}
