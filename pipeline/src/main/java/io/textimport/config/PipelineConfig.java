package io.textimport.config;

import io.textimport.runtime.ConversionFailurePolicy;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public record PipelineConfig(
        int workers,
        boolean ordered,
        ConversionFailurePolicy failurePolicy,
        byte recordDelimiter,
        Charset charset
) {
    public PipelineConfig {
        workers = Math.max(1, workers);
        if (failurePolicy == null) failurePolicy = ConversionFailurePolicy.CONTINUE;
        if (charset == null) charset = StandardCharsets.UTF_8;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(Runtime.getRuntime().availableProcessors(), false,
                ConversionFailurePolicy.CONTINUE, (byte) '\n', StandardCharsets.UTF_8);
    }

    public static PipelineConfig fromEnv() {
        int workers = Integer.parseInt(setting("textimport.workers", "TEXTIMPORT_WORKERS", String.valueOf(Runtime.getRuntime().availableProcessors())));
        boolean ordered = Boolean.parseBoolean(setting("textimport.ordered", "TEXTIMPORT_ORDERED", "false"));
        ConversionFailurePolicy policy = ConversionFailurePolicy.parse(setting("textimport.failurePolicy", "TEXTIMPORT_FAILURE_POLICY", "continue"));
        byte delimiter = parseDelimiter(setting("textimport.delimiter", "TEXTIMPORT_DELIMITER", "\\n"));
        Charset charset = Charset.forName(setting("textimport.charset", "TEXTIMPORT_CHARSET", "UTF-8"));
        return new PipelineConfig(workers, ordered, policy, delimiter, charset);
    }

    public PipelineConfig withWorkers(int w) { return new PipelineConfig(w, ordered, failurePolicy, recordDelimiter, charset); }
    public PipelineConfig withOrdered(boolean o) { return new PipelineConfig(workers, o, failurePolicy, recordDelimiter, charset); }
    public PipelineConfig withFailurePolicy(ConversionFailurePolicy p) { return new PipelineConfig(workers, ordered, p, recordDelimiter, charset); }

    static byte parseDelimiter(String s) {
        return switch (s) {
            case "\\n" -> (byte) '\n';
            case "\\r" -> (byte) '\r';
            case "\\0" -> (byte) 0;
            default -> {
                if (s.length() != 1 || s.charAt(0) > 0x7F) {
                    throw new IllegalArgumentException("record delimiter must be a single ASCII character: " + s);
                }
                yield (byte) s.charAt(0);
            }
        };
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
