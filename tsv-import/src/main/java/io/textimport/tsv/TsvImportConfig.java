package io.textimport.tsv;

import io.textimport.config.PipelineConfig;

import java.nio.file.Path;

/**
 * @param out      output file, or {@code null} for stdout
 * @param options  per-record conversion switches
 * @param pipeline decode pipeline settings
 */
public record TsvImportConfig(
        Path out,
        TsvOptions options,
        PipelineConfig pipeline
) {
    public TsvImportConfig {
        if (options == null) options = TsvOptions.defaults();
        if (pipeline == null) pipeline = PipelineConfig.defaults();
    }
}
