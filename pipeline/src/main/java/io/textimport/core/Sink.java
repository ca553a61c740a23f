package io.textimport.core;

import java.io.Closeable;

/**
 * Sink consumes conversion outcomes, in index order when the pipeline runs ordered.
 * Called from a single thread.
 */
public interface Sink<D> extends Closeable {
    void accept(ConversionOutcome<D> outcome) throws Exception;

    @Override
    default void close() {}
}
