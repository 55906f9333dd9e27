package io.dumpclean.wikidump;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.ProvisionException;
import com.google.inject.TypeLiteral;
import io.dumpclean.config.PipelineConfig;
import io.dumpclean.error.PipelineException;
import io.dumpclean.metrics.Metrics;
import io.dumpclean.runtime.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI to de-duplicate and clean a MediaWiki XML dump.
 */
@CommandLine.Command(name = "dumpclean", mixinStandardHelpOptions = true,
        description = "Drop duplicate pages from a MediaWiki XML dump and clean every page body with an external cleaner")
public final class DumpCleanMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DumpCleanMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    static final Key<Pipeline<Page, String>> PIPELINE = Key.get(new TypeLiteral<Pipeline<Page, String>>() {});

    private static final PipelineConfig DEFAULTS = PipelineConfig.fromEnv();

    @CommandLine.Option(names = "--in", required = true, description = "The input dump to process")
    Path input;

    @CommandLine.Option(names = "--out", required = true, description = "The output dump")
    Path output;

    @CommandLine.Option(names = "--workers", description = "How many worker tasks (default: ${DEFAULT-VALUE})")
    int workers = DEFAULTS.workers();

    @CommandLine.Option(names = "--queue-capacity", description = "Capacity of the handoff and result queues, 0 for unbuffered (default: ${DEFAULT-VALUE})")
    int queueCapacity = DEFAULTS.queueCapacity();

    @CommandLine.Option(names = "--ordered", description = "Write pages in input order instead of completion order")
    boolean ordered = DEFAULTS.ordered();

    @CommandLine.Option(names = "--cleaner", description = "Cleaner executable; default <dir of --in>/../scripts/parse_xml")
    Path cleaner;

    @CommandLine.Option(names = "--cleaner-url", description = "Clean through this HTTP endpoint instead of a process")
    URI cleanerUrl;

    @CommandLine.Option(names = "--cleaner-timeout", defaultValue = "${env:DUMPCLEAN_CLEANER_TIMEOUT:-PT0S}",
            description = "Per-page cleaner timeout as ISO-8601 duration, PT0S for none (default: ${DEFAULT-VALUE})")
    Duration cleanerTimeout;

    @CommandLine.Option(names = "--dead-letter", description = "Append dropped pages to this JSONL file")
    Path deadLetter;

    @CommandLine.Option(names = "--report-every", description = "Log metrics every N seconds, 0 for never (default: ${DEFAULT-VALUE})")
    long reportEverySeconds = 0;

    public static void main(String[] args) {
        int code = new CommandLine(new DumpCleanMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        if (workers < 1) {
            log.error("--workers must be at least 1, got {}", workers);
            return EXIT_USAGE;
        }
        if (queueCapacity < 0) {
            log.error("--queue-capacity must not be negative, got {}", queueCapacity);
            return EXIT_USAGE;
        }
        DumpConfig config = new DumpConfig(input, output,
                new PipelineConfig(workers, queueCapacity, ordered),
                cleaner, cleanerUrl, cleanerTimeout, deadLetter, Duration.ofSeconds(Math.max(0, reportEverySeconds)));
        return run(config);
    }

    static int run(DumpConfig config) {
        Injector injector;
        Pipeline<Page, String> pipeline;
        try {
            injector = Guice.createInjector(new DumpCleanModule(config));
            pipeline = injector.getInstance(PIPELINE);
        } catch (ProvisionException | CreationException e) {
            log.error("Cannot set up run: {}", rootCause(e).toString());
            return EXIT_FAILED;
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        log.info("Cleaning {} into {} with {}", config.input(), config.output(),
                config.cleanerUrl() != null ? config.cleanerUrl() : config.cleaner());

        Slf4jReporter reporter = null;
        if (!config.reportEvery().isZero()) {
            reporter = Slf4jReporter.forRegistry(registry)
                    .outputTo(LoggerFactory.getLogger("io.dumpclean.metrics"))
                    .convertRatesTo(TimeUnit.SECONDS)
                    .convertDurationsTo(TimeUnit.MILLISECONDS)
                    .build();
            reporter.start(config.reportEvery().toSeconds(), TimeUnit.SECONDS);
        }
        Thread hook = new Thread(pipeline::cancel, "dumpclean-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            pipeline.run();
            logSummary(pipeline.metrics());
            return EXIT_OK;
        } catch (PipelineException e) {
            log.error("Run aborted: {}", e.getMessage());
            logSummary(pipeline.metrics());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipeline.cancel();
            return EXIT_INTERRUPTED;
        } finally {
            if (reporter != null) reporter.stop();
            removeHook(hook);
        }
    }

    private static void logSummary(Metrics m) {
        long read = m.count(Metrics.INPUT_RATE) + m.count(Metrics.DUPLICATES);
        log.info("Summary: pages={} duplicates={} redirects={} cleaned={} rejected={} written={}",
                read,
                m.count(Metrics.DUPLICATES),
                m.count(PageCleanupTransform.REDIRECTS),
                m.count(PageCleanupTransform.CLEANED),
                m.count(Metrics.ERROR_RATE),
                m.count(Metrics.OUTPUT_RATE));
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            log.debug("JVM already shutting down, leaving cancel hook registered");
        }
    }

    private static Throwable rootCause(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null && c.getCause() != c) c = c.getCause();
        return c;
    }
}
