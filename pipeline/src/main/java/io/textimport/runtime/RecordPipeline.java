package io.textimport.runtime;

import com.codahale.metrics.Meter;
import io.textimport.core.ConversionOutcome;
import io.textimport.core.RawRecord;
import io.textimport.core.RecordConverter;
import io.textimport.core.RecordSource;
import io.textimport.core.Sink;
import io.textimport.error.SourceReadException;
import io.textimport.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-source -> decode pool -> merged sink pipeline with optional ordering and one terminal result.
 *
 * <p>Two stages report to a {@link StageQuorum}: {@code read} (the source loop) and {@code decode}
 * (the worker pool together with the merger, which finishes only after every worker has exited).
 * A read failure closes the raw channel so in-flight records drain normally. A fatal merge failure
 * closes the same channel from the other end and the merger discards whatever is still in flight.
 *
 * <p>Instances are single-use.
 */
public class RecordPipeline<D> {
    private static final Logger log = LoggerFactory.getLogger(RecordPipeline.class);

    public static final String READ_STAGE = "read";
    public static final String DECODE_STAGE = "decode";

    private final RecordSource source;
    private final DecodeWorkerPool<D> pool;
    private final int workers;
    private final boolean ordered;
    private final ConversionFailurePolicy failurePolicy;
    private final Metrics metrics;
    private final Meter readMeter;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile long emitted = 0;
    private volatile int maxBuffered = 0;

    public RecordPipeline(RecordSource source,
                          RecordConverter<D> converter,
                          int workers,
                          boolean ordered,
                          ConversionFailurePolicy failurePolicy,
                          Metrics metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.workers = Math.max(1, workers);
        this.ordered = ordered;
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.pool = new DecodeWorkerPool<>(this.workers, converter, metrics);
        this.readMeter = metrics.meter(Metrics.RECORDS_READ);
    }

    /**
     * Run to completion, delivering outcomes to {@code sink} from a single merge thread.
     * Returns only after every stage has stopped, so the sink sees nothing after the result.
     *
     * @throws InterruptedException if the calling thread is interrupted; all stages are torn down first
     */
    public PipelineResult run(Sink<D> sink) throws InterruptedException {
        Objects.requireNonNull(sink, "sink");
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("pipeline already run");

        BoundedChannel<RawRecord> raw = new BoundedChannel<>(workers);
        BoundedChannel<ConversionOutcome<D>> decoded = new BoundedChannel<>(workers);
        Semaphore window = ordered ? new Semaphore(workers) : null;
        StageQuorum quorum = new StageQuorum(2);
        OutcomeMerger<D> merger = new OutcomeMerger<>(ordered, failurePolicy, sink, window, raw, metrics);

        ExecutorService decoders = Executors.newFixedThreadPool(workers, decodeThreads());
        Thread reader = new Thread(() -> quorum.report(READ_STAGE, read(raw, window)), "pipeline-source");
        Thread mergerThread = new Thread(() -> quorum.report(DECODE_STAGE, merge(merger, raw, decoded, window)), "pipeline-merge");

        log.info("Starting pipeline: workers={} ordered={} failurePolicy={}", workers, ordered, failurePolicy);
        try {
            pool.start(raw, decoded, decoders);
            reader.start();
            mergerThread.start();

            PipelineResult result = quorum.await();
            reader.join();
            mergerThread.join();
            emitted = merger.emitted();
            maxBuffered = merger.maxBuffered();
            log.info("Pipeline finished: read={} emitted={} result={}", source.processed(), emitted, result);
            return result;
        } catch (InterruptedException ie) {
            abort(raw, decoded, window);
            reader.interrupt();
            mergerThread.interrupt();
            decoders.shutdownNow();
            throw ie;
        } finally {
            decoders.shutdown();
        }
    }

    private Throwable read(BoundedChannel<RawRecord> raw, Semaphore window) {
        try {
            while (!raw.isClosed()) {
                Optional<RawRecord> next = source.next();
                if (next.isEmpty()) return null;
                if (window != null) window.acquire();
                if (!raw.send(next.get())) {
                    if (window != null) window.release();
                    break;
                }
                readMeter.mark();
            }
            log.debug("Downstream closed; reader stopped after {} record(s)", source.processed());
            return null;
        } catch (SourceReadException e) {
            return e;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ie;
        } catch (RuntimeException | Error e) {
            return e;
        } finally {
            raw.close();
        }
    }

    private Throwable merge(OutcomeMerger<D> merger,
                            BoundedChannel<RawRecord> raw,
                            BoundedChannel<ConversionOutcome<D>> decoded,
                            Semaphore window) {
        try {
            return merger.merge(decoded);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            abort(raw, decoded, window);
            return ie;
        } catch (RuntimeException | Error e) {
            abort(raw, decoded, window);
            return e;
        }
    }

    // Unblocks every stage: reader (send or window), workers (send) and merger (receive).
    private void abort(BoundedChannel<RawRecord> raw, BoundedChannel<ConversionOutcome<D>> decoded, Semaphore window) {
        raw.close();
        decoded.close();
        if (window != null) window.release(workers);
    }

    private static ThreadFactory decodeThreads() {
        AtomicInteger n = new AtomicInteger(0);
        return r -> new Thread(r, "pipeline-decode-" + n.incrementAndGet());
    }

    public int workers() { return workers; }

    /** Outcomes delivered to the sink by the last run. */
    public long emitted() { return emitted; }

    /** High-water mark of the reorder buffer during the last run; 0 when unordered. */
    public int maxBuffered() { return maxBuffered; }
}
