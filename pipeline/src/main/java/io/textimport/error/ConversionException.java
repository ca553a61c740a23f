package io.textimport.error;

/**
 * A single record could not be converted. Carried in that record's outcome; never retried.
 */
public class ConversionException extends Exception {
    private final long index;

    public ConversionException(long index, String message) {
        super(message);
        this.index = index;
    }

    public ConversionException(long index, String message, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    public long index() { return index; }
}
