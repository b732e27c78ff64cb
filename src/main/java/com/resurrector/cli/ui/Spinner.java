package com.resurrector.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * Shows a spinning cursor on the terminal while an analysis runs in the background.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs the task on a worker thread, redrawing the label every 100ms until it finishes.
     *
     * @param label Text shown next to the spinner.
     * @param task  The work to run.
     * @param <T>   The result type.
     * @return The task's result.
     * @throws RuntimeException whatever runtime exception the task threw, unwrapped.
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        int frame = 0;
        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clear(writer, label);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33m" + label + " " + FRAMES[frame++ % FRAMES.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (ExecutionException e) {
            clear(writer, label);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            clear(writer, label);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + label, e);
        } finally {
            executor.shutdownNow();
        }
    }

    private void clear(PrintWriter writer, String label) {
        writer.print("\r" + " ".repeat(label.length() + 2) + "\r");
        writer.flush();
    }
}
