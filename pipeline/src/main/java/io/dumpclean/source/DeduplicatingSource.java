package io.dumpclean.source;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.dumpclean.core.Record;
import io.dumpclean.core.Source;
import io.dumpclean.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Dedup gate in front of another source: the first record for a key passes, later ones are
 * dropped with a warning. The set of seen keys grows for the life of the source and is never
 * evicted, so memory is proportional to the number of distinct keys in the input.
 * <p>
 * Not thread-safe; the pipeline polls sources from a single thread.
 */
public class DeduplicatingSource<T> implements Source<T> {
    private static final Logger log = LoggerFactory.getLogger(DeduplicatingSource.class);

    private final Source<T> delegate;
    private final Function<? super T, String> keyOf;
    private final String keyName;
    private final Set<String> seen = new HashSet<>();
    private final Counter duplicates;

    public DeduplicatingSource(Source<T> delegate, Function<? super T, String> keyOf, String keyName, MetricRegistry registry) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.keyOf = Objects.requireNonNull(keyOf, "keyOf");
        this.keyName = keyName == null ? "key" : keyName;
        this.duplicates = registry.counter(Metrics.DUPLICATES);
    }

    @Override
    public Optional<Record<T>> poll() throws Exception {
        while (true) {
            Optional<Record<T>> next = delegate.poll();
            if (next.isEmpty()) return next;
            String key = Objects.requireNonNull(keyOf.apply(next.get().payload()), keyName);
            if (seen.add(key)) return next;
            duplicates.inc();
            log.warn("Duplicate {}: {}. Skipping...", keyName, key);
        }
    }

    @Override
    public boolean isFinished() {
        return delegate.isFinished();
    }

    public int distinctKeys() { return seen.size(); }

    public long duplicateCount() { return duplicates.getCount(); }

    @Override
    public void close() throws IOException {
        delegate.close();
    }
}
