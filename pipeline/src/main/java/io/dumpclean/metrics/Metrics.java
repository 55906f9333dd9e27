package io.dumpclean.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String INPUT_RATE = "pipeline.input.rate";
    public static final String OUTPUT_RATE = "pipeline.output.rate";
    public static final String ERROR_RATE = "pipeline.error.rate";
    public static final String DUPLICATES = "pipeline.source.duplicates";
    public static final String SOURCE_TIME = "pipeline.source.time";
    public static final String TRANSFORM_TIME = "pipeline.transform.time";
    public static final String SINK_TIME = "pipeline.sink.time";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Count of a meter or counter, 0 when it was never registered. */
    public long count(String name) {
        Meter m = registry.getMeters().get(name);
        if (m != null) return m.getCount();
        Counter c = registry.getCounters().get(name);
        return c == null ? 0 : c.getCount();
    }
}
