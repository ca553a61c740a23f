package io.textimport.error;

import java.io.IOException;

/**
 * The record source failed while reading. Fatal to the pipeline: no further records can be produced.
 */
public class SourceReadException extends IOException {
    private final long ordinal;

    public SourceReadException(long ordinal, IOException cause) {
        super("read error on entry #" + ordinal + ": " + cause.getMessage(), cause);
        this.ordinal = ordinal;
    }

    /** 1-based ordinal of the record that was being read. */
    public long ordinal() { return ordinal; }
}
