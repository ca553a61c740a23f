package io.textimport.core;

import io.textimport.error.ConversionException;

import java.util.Objects;

/**
 * Result of converting one {@link RawRecord}: either a document or the error that prevented it.
 * Exactly one outcome exists per raw record; {@link #index()} is the only ordering key downstream.
 */
public final class ConversionOutcome<D> {
    private final long index;
    private final D document;
    private final ConversionException error;

    private ConversionOutcome(long index, D document, ConversionException error) {
        this.index = index;
        this.document = document;
        this.error = error;
    }

    public static <D> ConversionOutcome<D> success(long index, D document) {
        return new ConversionOutcome<>(index, Objects.requireNonNull(document, "document"), null);
    }

    public static <D> ConversionOutcome<D> failure(long index, ConversionException error) {
        return new ConversionOutcome<>(index, null, Objects.requireNonNull(error, "error"));
    }

    public long index() { return index; }
    public boolean isSuccess() { return error == null; }

    /**
     * The converted document.
     *
     * @throws IllegalStateException if this outcome carries an error
     */
    public D document() {
        if (error != null) throw new IllegalStateException("outcome #" + index + " failed", error);
        return document;
    }

    /** The conversion error, or {@code null} for a successful outcome. */
    public ConversionException error() { return error; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionOutcome<?> that)) return false;
        return index == that.index && Objects.equals(document, that.document) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, document, error);
    }

    @Override
    public String toString() {
        return "ConversionOutcome{" +
                "index=" + index +
                (error == null ? ", document=" + document : ", error=" + error.getMessage()) +
                '}';
    }
}
