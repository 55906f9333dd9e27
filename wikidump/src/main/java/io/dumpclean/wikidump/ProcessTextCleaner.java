package io.dumpclean.wikidump;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external executable once per text: the text goes to its stdin, the cleaned text is
 * whatever it prints on stdout and stderr combined. A non-zero exit status fails the call, and so
 * does a child that exits before taking all of its input.
 * <p>
 * With a zero timeout a hung process blocks its worker for good; a positive timeout bounds the
 * whole call, kills the process and fails the call instead.
 */
public class ProcessTextCleaner implements TextCleaner {
    private static final Logger log = LoggerFactory.getLogger(ProcessTextCleaner.class);

    private final List<String> command;
    private final Duration timeout;

    public ProcessTextCleaner(Path executable, Duration timeout) {
        this(List.of(executable.toString()), timeout);
    }

    public ProcessTextCleaner(List<String> command, Duration timeout) {
        if (command.isEmpty()) throw new IllegalArgumentException("empty cleaner command");
        this.command = List.copyOf(command);
        this.timeout = timeout == null ? Duration.ZERO : timeout;
    }

    @Override
    public String clean(String text) throws TextCleanerException, InterruptedException {
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new TextCleanerException("Cannot start " + command.get(0), e);
        }
        try {
            long deadline = System.nanoTime() + timeout.toNanos();
            // feed and drain on separate threads so a child that stops reading cannot block past the deadline
            CompletableFuture<byte[]> output = CompletableFuture.supplyAsync(() -> readAll(process), Pipes.executor());
            CompletableFuture<Void> input = CompletableFuture.runAsync(() -> writeAll(process, text), Pipes.executor());
            if (!waitFor(process, deadline)) {
                throw new TextCleanerException(command.get(0) + " timed out after " + timeout, null);
            }
            String cleaned = new String(collect(output, deadline, "read output of"), StandardCharsets.UTF_8);
            int exit = process.exitValue();
            if (exit != 0) {
                throw new TextCleanerException(command.get(0) + " exited with status " + exit, exit, cleaned);
            }
            collect(input, deadline, "write input to");
            return cleaned;
        } finally {
            if (process.isAlive()) {
                log.debug("Killing {}", command.get(0));
                process.destroyForcibly();
            }
        }
    }

    private boolean hasTimeout() {
        return !timeout.isZero() && !timeout.isNegative();
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private boolean waitFor(Process process, long deadline) throws InterruptedException {
        if (!hasTimeout()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(remaining(deadline), TimeUnit.NANOSECONDS);
    }

    private <T> T collect(CompletableFuture<T> io, long deadline, String what) throws TextCleanerException, InterruptedException {
        try {
            if (!hasTimeout()) return io.get();
            return io.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw new TextCleanerException("Cannot " + what + " " + command.get(0), e.getCause());
        } catch (TimeoutException e) {
            throw new TextCleanerException("Cannot " + what + " " + command.get(0) + " within " + timeout, e);
        }
    }

    private static void writeAll(Process process, String text) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] readAll(Process process) {
        try {
            return process.getInputStream().readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // Pipe readers and writers block; keep them off the common pool.
    static final class Pipes {
        private static final ExecutorService EXEC = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cleaner-pipe"); t.setDaemon(true); return t;
        });
        static ExecutorService executor() { return EXEC; }
    }
}
