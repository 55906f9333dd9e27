package io.dumpclean.config;

/**
 * Runtime shape of a pipeline. A queue capacity of 0 means unbuffered handoff.
 */
public record PipelineConfig(
        int workers,
        int queueCapacity,
        boolean ordered
) {
    public PipelineConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        if (queueCapacity < 0) throw new IllegalArgumentException("queueCapacity must be >= 0, got " + queueCapacity);
    }

    public static PipelineConfig fromEnv() {
        int workers = Integer.parseInt(System.getProperty("dumpclean.workers", System.getenv().getOrDefault("DUMPCLEAN_WORKERS", "1")));
        int queue = Integer.parseInt(System.getProperty("dumpclean.queue", System.getenv().getOrDefault("DUMPCLEAN_QUEUE_CAPACITY", "0")));
        boolean ordered = Boolean.parseBoolean(System.getProperty("dumpclean.ordered", System.getenv().getOrDefault("DUMPCLEAN_ORDERED", "false")));
        return new PipelineConfig(workers, queue, ordered);
    }
}
