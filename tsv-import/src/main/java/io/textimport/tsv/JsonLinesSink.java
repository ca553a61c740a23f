package io.textimport.tsv;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.textimport.core.ConversionOutcome;
import io.textimport.core.Sink;
import io.textimport.core.StructuredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Writes each converted document as one JSON object per line. Failed records are logged and counted.
 */
public class JsonLinesSink implements Sink<StructuredDocument> {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesSink.class);

    private final OutputStream out;
    private final ObjectMapper mapper;
    private final boolean closeTarget;
    private long written = 0;
    private long failed = 0;

    /**
     * @param closeTarget whether {@link #close()} closes {@code out}; false for stdout
     */
    public JsonLinesSink(OutputStream out, ObjectMapper mapper, boolean closeTarget) {
        this.out = new BufferedOutputStream(Objects.requireNonNull(out, "out"));
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.closeTarget = closeTarget;
    }

    @Override
    public void accept(ConversionOutcome<StructuredDocument> outcome) throws IOException {
        if (!outcome.isSuccess()) {
            failed++;
            log.warn("Skipping document #{}: {}", outcome.index(), outcome.error().getMessage());
            return;
        }
        out.write(mapper.writeValueAsBytes(outcome.document().toMap()));
        out.write('\n');
        written++;
    }

    public long written() { return written; }
    public long failed() { return failed; }

    @Override
    public void close() {
        try {
            out.flush();
            if (closeTarget) out.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
