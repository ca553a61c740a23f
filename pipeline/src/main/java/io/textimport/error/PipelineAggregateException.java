package io.textimport.error;

import java.util.Objects;

/**
 * Terminal error of a pipeline run: the first fatal failure reported by any stage.
 */
public class PipelineAggregateException extends Exception {
    private final String stage;

    public PipelineAggregateException(String stage, Throwable cause) {
        super("stage '" + stage + "' failed: " + Objects.requireNonNull(cause, "cause").getMessage(), cause);
        this.stage = stage;
    }

    /** Name of the stage that failed first. */
    public String stage() { return stage; }
}
