package io.textimport.runtime;

import io.textimport.error.PipelineAggregateException;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal value of one pipeline run: completed normally, or failed with the first fatal error.
 */
public final class PipelineResult {
    private static final PipelineResult COMPLETED = new PipelineResult(null);

    private final PipelineAggregateException error;

    private PipelineResult(PipelineAggregateException error) {
        this.error = error;
    }

    public static PipelineResult completed() { return COMPLETED; }

    public static PipelineResult failed(PipelineAggregateException error) {
        return new PipelineResult(Objects.requireNonNull(error, "error"));
    }

    public boolean isCompleted() { return error == null; }
    public boolean isFailed() { return error != null; }
    public Optional<PipelineAggregateException> error() { return Optional.ofNullable(error); }

    public void throwIfFailed() throws PipelineAggregateException {
        if (error != null) throw error;
    }

    @Override
    public String toString() {
        return error == null ? "PipelineResult{completed}" : "PipelineResult{failed: " + error.getMessage() + "}";
    }
}
