package io.textimport.core;

import io.textimport.error.SourceReadException;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A RecordSource produces raw records with gap-free indices starting at 0.
 * It is read by exactly one thread.
 */
public interface RecordSource extends Closeable {
    /**
     * Read the next record. Returns empty once the input is exhausted.
     *
     * @throws SourceReadException if the underlying stream fails; no further records can be read
     */
    Optional<RawRecord> next() throws SourceReadException;

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    /** Number of records handed out so far. */
    long processed();

    @Override
    default void close() throws IOException {}
}
