package io.textimport.runtime;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.textimport.core.ConversionOutcome;
import io.textimport.core.Sink;
import io.textimport.metrics.Metrics;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Forwards decoded outcomes to the sink, either as they complete or re-sequenced by index.
 *
 * <p>In ordered mode every emitted or discarded outcome returns one permit to the in-flight
 * window the reading stage draws from, which caps the reorder buffer at the window size.
 * After a fatal failure the merger closes the upstream channel and keeps draining (and discarding)
 * until the workers have exited.
 */
public class OutcomeMerger<D> {
    private final boolean ordered;
    private final ConversionFailurePolicy failurePolicy;
    private final Sink<D> sink;
    private final Semaphore window; // null when unordered
    private final BoundedChannel<?> upstream;
    private final Timer sinkTimer;
    private final Meter emittedMeter;
    private final Histogram bufferedHistogram;

    private long emitted = 0;
    private int maxBuffered = 0;

    public OutcomeMerger(boolean ordered,
                         ConversionFailurePolicy failurePolicy,
                         Sink<D> sink,
                         Semaphore window,
                         BoundedChannel<?> upstream,
                         Metrics metrics) {
        if (ordered && window == null) throw new IllegalArgumentException("ordered merge requires an in-flight window");
        this.ordered = ordered;
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.window = window;
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.sinkTimer = metrics.timer(Metrics.SINK_TIME);
        this.emittedMeter = metrics.meter(Metrics.OUTCOMES_EMITTED);
        this.bufferedHistogram = metrics.histogram(Metrics.MERGE_BUFFERED);
    }

    /**
     * Consume the channel until it is closed and drained.
     *
     * @return the fatal error that stopped delivery, or {@code null} if every outcome was delivered
     */
    public Throwable merge(BoundedChannel<ConversionOutcome<D>> outcomes) throws InterruptedException {
        OrderedBuffer<D> buffer = new OrderedBuffer<>(0);
        Throwable failure = null;
        Optional<ConversionOutcome<D>> next;
        while ((next = outcomes.receive()).isPresent()) {
            ConversionOutcome<D> outcome = next.get();
            if (failure != null) {
                release(1);
                continue;
            }
            if (ordered) {
                buffer.add(outcome);
                maxBuffered = Math.max(maxBuffered, buffer.size());
                bufferedHistogram.update(buffer.size());
                ConversionOutcome<D> ready;
                while (failure == null && (ready = buffer.pollNext()) != null) {
                    failure = deliver(ready);
                }
            } else {
                failure = deliver(outcome);
            }
            if (failure != null) {
                upstream.close();
                release(buffer.clear());
            }
        }
        if (failure == null && !buffer.isEmpty()) {
            return new IllegalStateException("outcome stream ended with a gap at index " + buffer.nextIndex());
        }
        return failure;
    }

    private Throwable deliver(ConversionOutcome<D> outcome) {
        release(1);
        if (!outcome.isSuccess() && failurePolicy == ConversionFailurePolicy.FAIL_FAST) {
            return outcome.error();
        }
        try (Timer.Context ignored = sinkTimer.time()) {
            sink.accept(outcome);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ie;
        } catch (Exception | Error e) {
            return e;
        }
        emitted++;
        emittedMeter.mark();
        return null;
    }

    private void release(int permits) {
        if (window != null && permits > 0) window.release(permits);
    }

    /** Outcomes handed to the sink so far. Read after {@link #merge} returns. */
    public long emitted() { return emitted; }

    /** Largest reorder-buffer size observed. Read after {@link #merge} returns. */
    public int maxBuffered() { return maxBuffered; }
}
