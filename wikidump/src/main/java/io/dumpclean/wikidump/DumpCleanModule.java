package io.dumpclean.wikidump;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.dumpclean.core.Sink;
import io.dumpclean.core.Source;
import io.dumpclean.core.Transform;
import io.dumpclean.error.DeadLetterSink;
import io.dumpclean.error.FileDeadLetterSink;
import io.dumpclean.runtime.Pipeline;
import io.dumpclean.runtime.PipelineBuilder;
import io.dumpclean.source.DeduplicatingSource;

import java.io.IOException;

public class DumpCleanModule extends AbstractModule {
    private final DumpConfig config;

    public DumpCleanModule(DumpConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(DumpConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton TextCleaner textCleaner() {
        if (config.cleanerUrl() != null) return new HttpTextCleaner(config.cleanerUrl(), config.cleanerTimeout());
        return new ProcessTextCleaner(config.cleaner(), config.cleanerTimeout());
    }

    @Provides Source<Page> source(MetricRegistry registry) throws IOException {
        return new DeduplicatingSource<>(new PageDumpSource(config.input()), Page::title, "title", registry);
    }

    @Provides Transform<Page, String> transform(TextCleaner cleaner, MetricRegistry registry) {
        return new PageCleanupTransform(cleaner, new PageXmlWriter(), registry);
    }

    @Provides Sink<String> sink() { return new DumpFileSink(config.output()); }

    @Provides @Singleton Pipeline<Page, String> pipeline(Source<Page> src, Transform<Page, String> tf, Sink<String> sk, MetricRegistry registry) throws IOException {
        DeadLetterSink<Page> dlq = config.deadLetter() == null ? null : new FileDeadLetterSink<>(config.deadLetter());
        return new PipelineBuilder<Page, String>()
                .source(src)
                .transform(tf)
                .sink(sk)
                .config(config.pipeline())
                .metrics(registry)
                .deadLetter(dlq)
                .build();
    }
}
