package io.textimport.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.textimport.core.ConversionOutcome;
import io.textimport.core.RawRecord;
import io.textimport.core.RecordConverter;
import io.textimport.error.ConversionException;
import io.textimport.metrics.Metrics;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers sharing one raw-record channel and one outcome channel. Every record taken
 * from the input yields exactly one outcome; conversion failures travel inside the outcome.
 * The last worker to exit closes the output channel.
 */
public class DecodeWorkerPool<D> {
    private final int size;
    private final RecordConverter<D> converter;
    private final Timer convertTimer;
    private final Meter convertedMeter;
    private final Meter failedMeter;

    public DecodeWorkerPool(int size, RecordConverter<D> converter, Metrics metrics) {
        this.size = Math.max(1, size);
        this.converter = Objects.requireNonNull(converter, "converter");
        this.convertTimer = metrics.timer(Metrics.CONVERT_TIME);
        this.convertedMeter = metrics.meter(Metrics.RECORDS_CONVERTED);
        this.failedMeter = metrics.meter(Metrics.RECORDS_FAILED);
    }

    public int size() { return size; }

    /**
     * Submit {@link #size()} workers to the executor. Returns immediately.
     */
    public void start(BoundedChannel<RawRecord> input, BoundedChannel<ConversionOutcome<D>> output, ExecutorService executor) {
        AtomicInteger alive = new AtomicInteger(size);
        for (int i = 0; i < size; i++) {
            executor.execute(() -> {
                try {
                    work(input, output);
                } finally {
                    if (alive.decrementAndGet() == 0) output.close();
                }
            });
        }
    }

    private void work(BoundedChannel<RawRecord> input, BoundedChannel<ConversionOutcome<D>> output) {
        try {
            while (true) {
                Optional<RawRecord> next = input.receive();
                if (next.isEmpty()) return;
                ConversionOutcome<D> outcome = convert(next.get());
                // closed under us only when the run is being aborted
                if (!output.send(outcome)) return;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    ConversionOutcome<D> convert(RawRecord in) {
        try (Timer.Context ignored = convertTimer.time()) {
            D doc = converter.convert(in.fields(), in.payload(), in.index());
            if (doc == null) {
                throw new ConversionException(in.index(), "converter returned no document for record #" + in.index());
            }
            convertedMeter.mark();
            return ConversionOutcome.success(in.index(), doc);
        } catch (ConversionException e) {
            failedMeter.mark();
            return ConversionOutcome.failure(in.index(), e);
        } catch (RuntimeException | Error e) {
            failedMeter.mark();
            return ConversionOutcome.failure(in.index(),
                    new ConversionException(in.index(), "converter failed on record #" + in.index() + ": " + e, e));
        }
    }
}
