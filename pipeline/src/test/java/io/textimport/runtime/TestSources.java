package io.textimport.runtime;

import io.textimport.core.ConversionOutcome;
import io.textimport.core.RawRecord;
import io.textimport.core.RecordSource;
import io.textimport.core.Sink;
import io.textimport.error.SourceReadException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

final class TestSources {
    private TestSources() {}

    static final List<String> FIELDS = List.of("value");

    /** Emits "0".."count-1", then fails with an I/O error if failAfter is reached. */
    static class CountingSource implements RecordSource {
        private final int count;
        private final int failAfter;
        private long processed = 0;
        private boolean finished = false;

        CountingSource(int count) { this(count, -1); }
        CountingSource(int count, int failAfter) { this.count = count; this.failAfter = failAfter; }

        @Override public Optional<RawRecord> next() throws SourceReadException {
            if (finished) return Optional.empty();
            if (failAfter >= 0 && processed == failAfter) {
                finished = true;
                throw new SourceReadException(processed + 1, new IOException("disk on fire"));
            }
            if (processed >= count) { finished = true; return Optional.empty(); }
            RawRecord r = new RawRecord(processed, String.valueOf(processed), FIELDS);
            processed++;
            return Optional.of(r);
        }
        @Override public boolean isFinished() { return finished; }
        @Override public long processed() { return processed; }
    }

    static class CollectingSink<D> implements Sink<D> {
        final List<ConversionOutcome<D>> outcomes = Collections.synchronizedList(new ArrayList<>());
        @Override public void accept(ConversionOutcome<D> outcome) { outcomes.add(outcome); }

        List<Long> indices() {
            synchronized (outcomes) {
                List<Long> out = new ArrayList<>();
                for (ConversionOutcome<D> o : outcomes) out.add(o.index());
                return out;
            }
        }
    }
}
