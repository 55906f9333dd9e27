package io.dumpclean.wikidump;

import io.dumpclean.config.PipelineConfig;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Everything one run needs. {@code cleanerUrl}, {@code deadLetter} may be null; when
 * {@code cleanerUrl} is set the HTTP cleaner is used and {@code cleaner} is ignored.
 */
public record DumpConfig(
        Path input,
        Path output,
        PipelineConfig pipeline,
        Path cleaner,
        URI cleanerUrl,
        Duration cleanerTimeout,
        Path deadLetter,
        Duration reportEvery
) {
    public DumpConfig {
        cleanerTimeout = cleanerTimeout == null ? Duration.ZERO : cleanerTimeout;
        reportEvery = reportEvery == null ? Duration.ZERO : reportEvery;
        if (cleaner == null && cleanerUrl == null) cleaner = defaultCleaner(input);
    }

    /** Dumps are expected under {@code build/} with the cleaner script in a sibling {@code scripts/}. */
    public static Path defaultCleaner(Path input) {
        Path dir = input.toAbsolutePath().getParent();
        return dir.resolve("../scripts/parse_xml").normalize();
    }
}
