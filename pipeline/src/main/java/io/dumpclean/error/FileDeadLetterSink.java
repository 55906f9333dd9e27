package io.dumpclean.error;

import io.dumpclean.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends one JSON line per dropped record.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        String key = e instanceof RecordRejectedException rejected ? rejected.key() : null;
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"seq\":%d,\"key\":%s,\"error\":\"%s\"}%n",
                Instant.now(), safe(stage), record == null ? -1 : record.seq(),
                key == null ? "null" : "\"" + safe(key) + "\"",
                safe(describe(e))
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            log.warn("Could not append dead letter for key {} to {}", key, file, io);
        }
    }

    private static String describe(Exception e) {
        Throwable cause = e.getCause();
        return cause == null ? String.valueOf(e.getMessage()) : e.getMessage() + ": " + cause;
    }

    private static String safe(String s) {
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", "\\n").replace("\r", "\\r");
    }
}
