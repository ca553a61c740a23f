package io.textimport.tsv;

import com.codahale.metrics.MetricRegistry;
import io.textimport.config.PipelineConfig;
import io.textimport.core.RecordConverter;
import io.textimport.core.Sink;
import io.textimport.core.StructuredDocument;
import io.textimport.runtime.PipelineResult;
import io.textimport.runtime.RecordPipeline;
import io.textimport.runtime.RecordPipelineBuilder;
import io.textimport.source.ByteCounter;
import io.textimport.source.DelimitedLineReader;
import io.textimport.source.DelimitedRecordSource;
import io.textimport.source.SourceProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * Reads TSV input and streams it through a {@link RecordPipeline} as {@link StructuredDocument}s.
 * One instance per input stream; {@link #streamDocuments} may be called once.
 */
public class TsvInputReader implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(TsvInputReader.class);

    private final DelimitedLineReader lines;
    private final ByteCounter bytes = new ByteCounter();
    private final PipelineConfig config;
    private final RecordConverter<StructuredDocument> converter;
    private final MetricRegistry registry;
    private List<String> fields;
    private volatile DelimitedRecordSource source;

    public TsvInputReader(InputStream in,
                          List<String> fields,
                          PipelineConfig config,
                          RecordConverter<StructuredDocument> converter,
                          MetricRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.lines = new DelimitedLineReader(in, config.recordDelimiter(), config.charset(), bytes);
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /** Take the field names from the first line of the input, replacing any given ones. */
    public void readAndValidateHeader() throws IOException {
        this.fields = TsvHeaderReader.read(lines);
    }

    public List<String> fields() { return fields; }

    /**
     * Convert every remaining line and deliver the outcomes to {@code sink}.
     *
     * @throws IllegalArgumentException if the field names are invalid
     */
    public PipelineResult streamDocuments(Sink<StructuredDocument> sink) throws InterruptedException {
        if (source != null) throw new IllegalStateException("documents already streamed");
        List<String> validated = FieldNames.validate(fields);
        log.info(validated.size() == 1 ? "Using field: {}" : "Using fields: {}", String.join(",", validated));
        source = new DelimitedRecordSource(lines, validated, bytes);
        RecordPipeline<StructuredDocument> pipeline = new RecordPipelineBuilder<StructuredDocument>()
                .source(source)
                .converter(converter)
                .config(config)
                .metrics(registry)
                .build();
        return pipeline.run(sink);
    }

    /** Records read after the header. */
    public long processed() {
        DelimitedRecordSource s = source;
        return s == null ? 0 : s.processed();
    }

    /** Bytes consumed so far, header included. */
    public long size() { return bytes.size(); }

    /** Snapshot of {@link #processed()} and {@link #size()}. */
    public SourceProgress progress() { return new SourceProgress(processed(), size()); }

    @Override
    public void close() throws IOException {
        lines.close();
    }
}
