package io.dumpclean.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.dumpclean.core.Record;
import io.dumpclean.core.Sink;
import io.dumpclean.core.Source;
import io.dumpclean.core.Transform;
import io.dumpclean.error.DeadLetterSink;
import io.dumpclean.error.PipelineException;
import io.dumpclean.error.RecordRejectedException;
import io.dumpclean.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-source -> N workers -> single-sink pipeline.
 * <p>
 * One source thread polls the source and blocks on a bounded handoff queue, which is the only
 * backpressure point. Workers take from the handoff queue, transform, and put into a bounded
 * result queue. One sink thread drains the result queue, so the sink never sees concurrent calls.
 * Output order is worker completion order unless {@code ordered} is set, in which case the sink
 * thread holds results back in an {@link OrderedBuffer} keyed by handoff sequence.
 * <p>
 * When the source is exhausted the handoff queue is closed with one end marker per worker. A latch
 * counts workers down as they exit; once it reaches zero the result queue is closed, the sink is
 * closed and the run is done. A fatal failure in any stage, or {@link #cancel()}, interrupts every
 * stage and aborts the sink.
 */
public class Pipeline<I, O> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    public enum State { IDLE, RUNNING, DRAINING, DONE, FAILED, CANCELLED }

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final int workers;
    private final int queueCapacity;
    private final boolean ordered;
    private final Metrics metrics;
    private final DeadLetterSink<I> deadLetter;

    private final BlockingQueue<Batch<I>> handoff;
    private final BlockingQueue<Batch<O>> results;
    private final ExecutorService workerPool;
    private final CountDownLatch workersDone;
    private final CountDownLatch sinkDone = new CountDownLatch(1);
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final List<Thread> stageThreads = new CopyOnWriteArrayList<>();

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    public Pipeline(Source<I> source,
                    Transform<I, O> transform,
                    Sink<O> sink,
                    int workers,
                    int queueCapacity,
                    boolean ordered,
                    Metrics metrics,
                    DeadLetterSink<I> deadLetter) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.workers = Math.max(1, workers);
        this.queueCapacity = Math.max(0, queueCapacity);
        this.ordered = ordered;
        this.metrics = Objects.requireNonNull(metrics);
        this.deadLetter = deadLetter;
        this.handoff = newQueue(this.queueCapacity);
        this.results = newQueue(this.queueCapacity);
        this.workerPool = Executors.newFixedThreadPool(this.workers, new StageThreadFactory("pipeline-worker-"));
        this.workersDone = new CountDownLatch(this.workers);
        this.sourceTimer = metrics.timer(Metrics.SOURCE_TIME);
        this.transformTimer = metrics.timer(Metrics.TRANSFORM_TIME);
        this.sinkTimer = metrics.timer(Metrics.SINK_TIME);
        this.inMeter = metrics.meter(Metrics.INPUT_RATE);
        this.outMeter = metrics.meter(Metrics.OUTPUT_RATE);
        this.errorMeter = metrics.meter(Metrics.ERROR_RATE);
    }

    private static <T> BlockingQueue<T> newQueue(int capacity) {
        return capacity == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Opens the sink and launches every stage.
     *
     * @throws PipelineException if the sink cannot be opened; nothing is started in that case
     */
    public void start() {
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            throw new IllegalStateException("Pipeline already started, state=" + state.get());
        }
        try {
            sink.open();
        } catch (IOException e) {
            failure.compareAndSet(null, e);
            state.set(State.FAILED);
            sinkDone.countDown();
            workerPool.shutdownNow();
            closeSource();
            throw new PipelineException("Cannot open sink", e);
        }

        stageThread(this::runSink, "pipeline-sink");
        for (int i = 1; i <= workers; i++) {
            final int id = i;
            workerPool.execute(() -> runWorker(id));
        }
        stageThread(this::runBarrier, "pipeline-barrier");
        stageThread(this::runSource, "pipeline-source");
        log.info("Pipeline started: workers={} queueCapacity={} ordered={}", workers, queueCapacity, ordered);
    }

    private void stageThread(Runnable body, String name) {
        Thread t = new Thread(body, name);
        t.setDaemon(true);
        stageThreads.add(t);
        t.start();
    }

    /**
     * Blocks until the sink has finished.
     *
     * @throws PipelineException if the run failed or was cancelled
     */
    public void await() throws InterruptedException {
        sinkDone.await();
        workerPool.shutdown();
        Throwable cause = failure.get();
        if (cause == null) return;
        if (cause instanceof PipelineException pe) throw pe;
        if (cause instanceof CancellationException) throw new PipelineException("Pipeline cancelled", cause);
        throw new PipelineException("Pipeline failed: " + cause.getMessage(), cause);
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        if (!sinkDone.await(timeout, unit)) return false;
        await();
        return true;
    }

    /** start() then await(). */
    public void run() throws InterruptedException {
        start();
        await();
    }

    /**
     * Stops every stage. The sink is aborted, so the output is left incomplete.
     */
    public void cancel() {
        State s = state.get();
        if (s == State.DONE || s == State.FAILED || s == State.CANCELLED) return;
        if (failure.compareAndSet(null, new CancellationException("pipeline cancelled"))) {
            if (state.getAndSet(State.CANCELLED) == State.IDLE) sinkDone.countDown();
            log.warn("Pipeline cancelled");
            interruptAll();
        }
    }

    public State state() { return state.get(); }
    public Metrics metrics() { return metrics; }

    private void runSource() {
        long handedOff;
        try {
            handedOff = pumpSource();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (Exception e) {
            fail("source", e);
            return;
        } catch (Error e) {
            fail("source", e);
            throw e;
        } finally {
            closeSource();
        }
        state.compareAndSet(State.RUNNING, State.DRAINING);
        log.info("Source done after {} record(s), draining {} worker(s)", handedOff, workers);
        try {
            for (int i = 0; i < workers; i++) {
                handoff.put(Batch.end());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // Returns the number of records handed off once the source is exhausted.
    private long pumpSource() throws Exception {
        long nextTicket = 0;
        while (true) {
            if (Thread.interrupted()) throw new InterruptedException();
            Optional<Record<I>> next;
            try (Timer.Context ignored = sourceTimer.time()) {
                next = source.poll();
            }
            if (next.isEmpty()) {
                if (source.isFinished()) return nextTicket;
                TimeUnit.MILLISECONDS.sleep(1);
                continue;
            }
            inMeter.mark();
            handoff.put(Batch.of(nextTicket++, next.get()));
        }
    }

    private void closeSource() {
        try {
            source.close();
        } catch (IOException e) {
            log.warn("Failed to close source", e);
        }
    }

    private void runWorker(int id) {
        log.debug("starting worker: {}", id);
        try {
            while (true) {
                Batch<I> next = handoff.take();
                if (next.isEnd()) break;
                Record<O> out = transformOrReject(next.record);
                if (out != null) {
                    results.put(Batch.of(next.ticket, out));
                } else if (ordered) {
                    results.put(Batch.skip(next.ticket));
                }
            }
            log.debug("exiting worker: {}", id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            fail("transform", e);
        } catch (Error e) {
            fail("transform", e);
            throw e;
        } finally {
            workersDone.countDown();
        }
    }

    // null when the record was rejected
    private Record<O> transformOrReject(Record<I> in) throws Exception {
        try (Timer.Context ignored = transformTimer.time()) {
            return Objects.requireNonNull(transform.apply(in), "transform returned null");
        } catch (RecordRejectedException e) {
            reject(in, e);
            return null;
        }
    }

    private void reject(Record<I> in, RecordRejectedException e) {
        errorMeter.mark();
        Throwable cause = e.getCause();
        log.warn("{} ({})", e.getMessage(), cause == null ? "no cause" : cause.getMessage());
        if (deadLetter != null) deadLetter.acceptFailure("transform", in, e);
    }

    // Closes the result queue once the last worker has exited.
    private void runBarrier() {
        try {
            workersDone.await();
            if (failure.get() != null) return;
            results.put(Batch.end());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runSink() {
        OrderedBuffer<Batch<O>> reorder = ordered ? new OrderedBuffer<>(0) : null;
        boolean completed = false;
        try {
            while (true) {
                Batch<O> next = results.take();
                if (next.isEnd()) break;
                if (reorder == null) {
                    write(next.record);
                    continue;
                }
                reorder.add(next.ticket, next);
                Batch<O> ready;
                while ((ready = reorder.pollNext()) != null) {
                    if (ready.record != null) write(ready.record);
                }
            }
            if (reorder != null && reorder.pending() > 0) {
                throw new IllegalStateException(reorder.pending() + " result(s) still waiting for seq " + reorder.nextSeq());
            }
            sink.close();
            completed = true;
            state.compareAndSet(State.DRAINING, State.DONE);
            log.info("Sink done, {} record(s) written", outMeter.getCount());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            fail("sink", e);
        } catch (Error e) {
            fail("sink", e);
            throw e;
        } finally {
            if (!completed) abortSink();
            sinkDone.countDown();
        }
    }

    private void write(Record<O> record) throws Exception {
        try (Timer.Context ignored = sinkTimer.time()) {
            sink.accept(record);
        }
        outMeter.mark();
    }

    private void abortSink() {
        try {
            sink.abort();
        } catch (IOException e) {
            log.warn("Failed to abort sink", e);
        }
    }

    private void fail(String stage, Throwable e) {
        if (failure.compareAndSet(null, e)) {
            state.set(State.FAILED);
            log.error("Fatal {} failure, aborting run", stage, e);
            interruptAll();
        }
    }

    private void interruptAll() {
        workerPool.shutdownNow();
        for (Thread t : stageThreads) {
            if (t != Thread.currentThread()) t.interrupt();
        }
    }

    @Override
    public void close() {
        cancel();
        workerPool.shutdownNow();
    }

    static final class Batch<T> {
        final long ticket;
        final Record<T> record; // null for skipped or end
        private final boolean end;

        private Batch(long ticket, Record<T> record, boolean end) {
            this.ticket = ticket; this.record = record; this.end = end;
        }
        static <T> Batch<T> of(long ticket, Record<T> record) { return new Batch<>(ticket, record, false); }
        static <T> Batch<T> skip(long ticket) { return new Batch<>(ticket, null, false); }
        static <T> Batch<T> end() { return new Batch<>(Long.MAX_VALUE, null, true); }
        boolean isEnd() { return end; }
    }

    private static final class StageThreadFactory implements java.util.concurrent.ThreadFactory {
        private final String prefix;
        private final AtomicInteger count = new AtomicInteger();

        StageThreadFactory(String prefix) { this.prefix = prefix; }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
