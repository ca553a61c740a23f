package io.textimport.core;

import io.textimport.error.ConversionException;

import java.util.List;

/**
 * Turns one raw record into a document. One implementation exists per text dialect; the pipeline
 * selects it once at construction and calls it concurrently from every decode worker, so
 * implementations must be stateless or thread-safe.
 */
@FunctionalInterface
public interface RecordConverter<D> {
    D convert(List<String> fields, String payload, long index) throws ConversionException;
}
