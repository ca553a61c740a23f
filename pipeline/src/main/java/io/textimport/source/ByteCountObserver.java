package io.textimport.source;

/**
 * Receives the number of bytes a reader has consumed. Only ever pushed to.
 */
@FunctionalInterface
public interface ByteCountObserver {
    ByteCountObserver NONE = n -> {};

    void bytesConsumed(long count);
}
