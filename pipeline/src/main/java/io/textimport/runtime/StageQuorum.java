package io.textimport.runtime;

import io.textimport.error.PipelineAggregateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects exactly one terminal signal from each of {@code n} independently running stages and
 * resolves them into a single {@link PipelineResult}. The first failure to arrive decides the
 * result; later signals are still collected so no reporting stage is left behind, but they are
 * discarded.
 *
 * <p>Reporting never blocks. {@link #await()} returns once all {@code n} stages have reported.
 */
public class StageQuorum {
    private static final Logger log = LoggerFactory.getLogger(StageQuorum.class);

    public enum State { RUNNING, DONE, FAILED, FAILED_FINAL }

    private final int expected;
    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final AtomicInteger reported = new AtomicInteger(0);
    private final AtomicBoolean awaited = new AtomicBoolean(false);
    private volatile State state = State.RUNNING;
    private volatile PipelineAggregateException firstFailure;

    public StageQuorum(int expected) {
        if (expected < 1) throw new IllegalArgumentException("expected must be >= 1: " + expected);
        this.expected = expected;
    }

    /**
     * Report a stage's terminal status.
     *
     * @param stage name used in the aggregate error
     * @param error the stage's fatal error, or {@code null} on success
     * @throws IllegalStateException if more than {@code n} signals are reported
     */
    public void report(String stage, Throwable error) {
        if (reported.incrementAndGet() > expected) {
            throw new IllegalStateException("stage '" + stage + "' reported after all " + expected + " signals arrived");
        }
        signals.add(new Signal(stage, error));
    }

    public void succeed(String stage) { report(stage, null); }

    public void fail(String stage, Throwable error) {
        if (error == null) throw new NullPointerException("error");
        report(stage, error);
    }

    /**
     * Block until every stage has reported and return the resolved result. Returns only once the
     * state is {@link State#DONE} or {@link State#FAILED_FINAL}, never at {@link State#FAILED}.
     *
     * @throws IllegalStateException if called more than once
     */
    public PipelineResult await() throws InterruptedException {
        if (!awaited.compareAndSet(false, true)) throw new IllegalStateException("quorum already awaited");
        for (int received = 0; received < expected; received++) {
            Signal s = signals.take();
            if (s.error == null) continue;
            if (firstFailure == null) {
                firstFailure = new PipelineAggregateException(s.stage, s.error);
                state = State.FAILED;
            } else {
                log.debug("Discarding failure from stage '{}' after earlier failure: {}", s.stage, s.error.toString());
            }
        }
        if (firstFailure == null) {
            state = State.DONE;
            return PipelineResult.completed();
        }
        state = State.FAILED_FINAL;
        return PipelineResult.failed(firstFailure);
    }

    public State state() { return state; }

    private record Signal(String stage, Throwable error) {}
}
