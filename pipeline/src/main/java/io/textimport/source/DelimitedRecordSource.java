package io.textimport.source;

import io.textimport.core.RawRecord;
import io.textimport.core.RecordSource;
import io.textimport.error.SourceReadException;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Emits one {@link RawRecord} per delimited line, assigning indices 0, 1, 2, ... in read order.
 * Counters are written only by the reading thread and published through {@link #progress()}.
 */
public class DelimitedRecordSource implements RecordSource {
    private final DelimitedLineReader reader;
    private final List<String> fields;
    private final ByteCounter bytes;
    private volatile long processed = 0;
    private volatile boolean finished = false;

    /**
     * @param reader line reader positioned after any header line
     * @param fields validated field names shared by every record
     * @param bytes  counter the reader reports to, or {@code null} when size is not tracked
     */
    public DelimitedRecordSource(DelimitedLineReader reader, List<String> fields, ByteCounter bytes) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.fields = List.copyOf(fields);
        this.bytes = bytes;
    }

    @Override
    public Optional<RawRecord> next() throws SourceReadException {
        if (finished) return Optional.empty();
        Optional<String> line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            finished = true;
            throw new SourceReadException(processed + 1, e);
        }
        if (line.isEmpty()) {
            finished = true;
            return Optional.empty();
        }
        RawRecord r = new RawRecord(processed, line.get(), fields);
        processed++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() { return finished; }

    @Override
    public long processed() { return processed; }

    public List<String> fields() { return fields; }

    public SourceProgress progress() {
        return new SourceProgress(processed, bytes == null ? 0 : bytes.size());
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
