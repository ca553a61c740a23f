package io.textimport.tsv;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.textimport.config.PipelineConfig;
import io.textimport.core.RecordConverter;
import io.textimport.core.StructuredDocument;
import io.textimport.metrics.Metrics;
import io.textimport.runtime.ConversionFailurePolicy;
import io.textimport.runtime.PipelineResult;
import io.textimport.source.SourceProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI that converts TSV input into JSON lines using the concurrent decode pipeline.
 */
@CommandLine.Command(name = "tsv-import", mixinStandardHelpOptions = true, description = "Convert tab-separated records into JSON documents")
public final class TsvImportMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(TsvImportMain.class);

    @CommandLine.Option(names = "--file", description = "Input file; default stdin")
    Path file;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output file for JSON lines; default stdout")
    Path out;

    @CommandLine.Option(names = {"-f", "--fields"}, split = ",", description = "Comma-separated field names")
    List<String> fields = new ArrayList<>();

    @CommandLine.Option(names = "--fieldFile", description = "File with one field name per line")
    Path fieldFile;

    @CommandLine.Option(names = "--headerline", description = "Use the first input line as field names")
    boolean headerLine;

    @CommandLine.Option(names = {"-j", "--numDecodingWorkers"}, description = "Number of decoding workers; default from TEXTIMPORT_WORKERS or CPU count")
    Integer workers;

    @CommandLine.Option(names = "--maintainInsertionOrder", description = "Emit documents in input order")
    boolean maintainInsertionOrder;

    @CommandLine.Option(names = "--stopOnError", description = "Fail the import at the first record that cannot be converted")
    boolean stopOnError;

    @CommandLine.Option(names = "--ignoreBlanks", description = "Omit fields with empty values")
    boolean ignoreBlanks;

    @CommandLine.Option(names = "--inferTypes", description = "Store numeric values as numbers instead of strings")
    boolean inferTypes;

    @CommandLine.Option(names = "--strictTokenCount", description = "Reject records whose value count differs from the field count")
    boolean strictTokenCount;

    public static void main(String[] args) {
        int code = new CommandLine(new TsvImportMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        List<String> names;
        try {
            names = resolveFields();
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return 2;
        }

        PipelineConfig pipelineConfig = PipelineConfig.fromEnv();
        if (workers != null) pipelineConfig = pipelineConfig.withWorkers(workers);
        if (maintainInsertionOrder) pipelineConfig = pipelineConfig.withOrdered(true);
        if (stopOnError) pipelineConfig = pipelineConfig.withFailurePolicy(ConversionFailurePolicy.FAIL_FAST);
        TsvImportConfig config = new TsvImportConfig(out, new TsvOptions(inferTypes, strictTokenCount, ignoreBlanks), pipelineConfig);

        Injector injector = Guice.createInjector(new TsvImportModule(config));
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        RecordConverter<StructuredDocument> converter = injector.getInstance(Key.get(new TypeLiteral<RecordConverter<StructuredDocument>>() {}));

        try (InputStream in = openInput();
             TsvInputReader reader = new TsvInputReader(in, names, config.pipeline(), converter, registry);
             JsonLinesSink sink = injector.getInstance(JsonLinesSink.class)) {
            if (headerLine) reader.readAndValidateHeader();
            PipelineResult result = reader.streamDocuments(sink);
            SourceProgress progress = reader.progress();
            log.info("{} document(s) written, {} failed, {} record(s) read, {} byte(s) consumed, convert p50={}ms",
                    sink.written(), sink.failed(), progress.processed(), progress.bytesRead(),
                    String.format("%.3f", registry.timer(Metrics.CONVERT_TIME).getSnapshot().getMedian() / 1_000_000.0));
            if (result.isFailed()) {
                log.error("Import failed: {}", result.error().orElseThrow().getMessage());
                return 1;
            }
            return 0;
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return 2;
        }
    }

    // stdin belongs to the JVM; closing the reader must leave it open
    private InputStream openInput() throws IOException {
        if (file != null) return Files.newInputStream(file);
        return new FilterInputStream(System.in) {
            @Override
            public void close() {}
        };
    }

    private List<String> resolveFields() throws IOException {
        boolean given = !fields.isEmpty() || fieldFile != null;
        if (headerLine && given) throw new IllegalArgumentException("incompatible options: --headerline with --fields or --fieldFile");
        if (!headerLine && !given) throw new IllegalArgumentException("must specify --fields, --fieldFile or --headerline");
        if (!fields.isEmpty() && fieldFile != null) throw new IllegalArgumentException("incompatible options: --fields and --fieldFile");
        if (headerLine) return List.of();
        List<String> names = new ArrayList<>();
        if (fieldFile != null) {
            for (String line : Files.readAllLines(fieldFile, StandardCharsets.UTF_8)) {
                String name = line.strip();
                if (!name.isEmpty()) names.add(name);
            }
        } else {
            for (String f : fields) names.add(f.strip());
        }
        return FieldNames.validate(names);
    }
}
