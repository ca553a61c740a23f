package io.textimport.runtime;

/**
 * What a per-record conversion failure does to the run.
 */
public enum ConversionFailurePolicy {
    /** Deliver the failed outcome to the sink and keep going. */
    CONTINUE,
    /** Stop at the first failed outcome in emission order and fail the run with it. */
    FAIL_FAST;

    public static ConversionFailurePolicy parse(String value) {
        return switch (value.trim().toLowerCase(java.util.Locale.ROOT).replace('-', '_')) {
            case "continue" -> CONTINUE;
            case "fail_fast", "stop" -> FAIL_FAST;
            default -> throw new IllegalArgumentException("unknown failure policy: " + value);
        };
    }
}
