package io.dumpclean.runtime;

import com.codahale.metrics.MetricRegistry;
import io.dumpclean.config.PipelineConfig;
import io.dumpclean.core.Sink;
import io.dumpclean.core.Source;
import io.dumpclean.core.Transform;
import io.dumpclean.error.DeadLetterSink;
import io.dumpclean.metrics.Metrics;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private int workers = 1;
    private int queueCapacity = 0;
    private boolean ordered = false;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink<I> deadLetter;

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> workers(int w) { this.workers = Math.max(1, w); return this; }
    public PipelineBuilder<I, O> queueCapacity(int c) { this.queueCapacity = Math.max(0, c); return this; }
    public PipelineBuilder<I, O> ordered(boolean o) { this.ordered = o; return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public PipelineBuilder<I, O> deadLetter(DeadLetterSink<I> d) { this.deadLetter = d; return this; }

    public PipelineBuilder<I, O> config(PipelineConfig c) {
        return workers(c.workers()).queueCapacity(c.queueCapacity()).ordered(c.ordered());
    }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(metricRegistry, "metrics");
        return new Pipeline<>(source, transform, sink, workers, queueCapacity, ordered, new Metrics(metricRegistry), deadLetter);
    }
}
