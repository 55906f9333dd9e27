package io.dumpclean.wikidump;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
public class ProcessTextCleanerTest {

    @Test
    void stdout_of_the_process_is_the_cleaned_text() throws Exception {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(List.of("cat"), Duration.ZERO);
        String text = "Hello <SPEC_START>World<SPEC_END>.\nÜber & more";
        assertEquals(text, cleaner.clean(text));
    }

    @Test
    void stderr_is_merged_into_the_output() throws Exception {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(List.of("sh", "-c", "cat; echo warn >&2"), Duration.ofSeconds(10));
        assertEquals("x\nwarn\n", cleaner.clean("x\n"));
    }

    @Test
    void large_bodies_do_not_deadlock_the_pipes() throws Exception {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(List.of("cat"), Duration.ofSeconds(20));
        String text = "0123456789abcdef".repeat(64 * 1024);
        assertEquals(text, cleaner.clean(text));
    }

    @Test
    void nonzero_exit_fails_with_status_and_output() {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(List.of("sh", "-c", "echo oops; exit 3"), Duration.ofSeconds(10));

        TextCleanerException e = assertThrows(TextCleanerException.class, () -> cleaner.clean("text"));

        assertEquals(3, e.exitCode());
        assertEquals("oops\n", e.output());
    }

    @Test
    void hung_process_is_killed_after_the_timeout() {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(List.of("sleep", "30"), Duration.ofMillis(300));

        long started = System.nanoTime();
        TextCleanerException e = assertThrows(TextCleanerException.class, () -> cleaner.clean("text"));

        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 20);
    }

    @Test
    void timeout_also_covers_a_child_that_never_reads_its_input() {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(List.of("sleep", "30"), Duration.ofMillis(500));
        String body = "x".repeat(1 << 20);

        long started = System.nanoTime();
        TextCleanerException e = assertThrows(TextCleanerException.class, () -> cleaner.clean(body));

        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 10);
    }

    @Test
    void child_that_exits_without_taking_its_input_fails_the_call() {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(List.of("true"), Duration.ZERO);

        TextCleanerException e = assertThrows(TextCleanerException.class, () -> cleaner.clean("x".repeat(1 << 20)));

        assertTrue(e.getMessage().startsWith("Cannot write input to true"), e.getMessage());
    }

    @Test
    void missing_executable_fails_the_call() {
        ProcessTextCleaner cleaner = new ProcessTextCleaner(Path.of("/nonexistent/parse_xml"), Duration.ZERO);

        TextCleanerException e = assertThrows(TextCleanerException.class, () -> cleaner.clean("text"));
        assertEquals(TextCleanerException.NO_EXIT_CODE, e.exitCode());
    }
}
