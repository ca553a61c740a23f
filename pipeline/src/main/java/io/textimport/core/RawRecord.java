package io.textimport.core;

import java.util.List;
import java.util.Objects;

/**
 * One unparsed delimited-text record together with the index the source assigned to it.
 * The field list is shared by every record of a run and is never mutated.
 */
public final class RawRecord {
    private final long index; // strictly increasing from 0 within a run
    private final String payload;
    private final List<String> fields;

    public RawRecord(long index, String payload, List<String> fields) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0: " + index);
        this.index = index;
        this.payload = Objects.requireNonNull(payload, "payload");
        this.fields = Objects.requireNonNull(fields, "fields");
    }

    public long index() { return index; }
    public String payload() { return payload; }
    public List<String> fields() { return fields; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawRecord that)) return false;
        return index == that.index && payload.equals(that.payload) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, payload, fields);
    }

    @Override
    public String toString() {
        return "RawRecord{" +
                "index=" + index +
                ", payload='" + payload + '\'' +
                '}';
    }
}
