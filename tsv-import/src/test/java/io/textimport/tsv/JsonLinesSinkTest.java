package io.textimport.tsv;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.textimport.core.ConversionOutcome;
import io.textimport.core.StructuredDocument;
import io.textimport.error.ConversionException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class JsonLinesSinkTest {
    @Test
    void writes_documents_and_counts_failures() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonLinesSink sink = new JsonLinesSink(out, new ObjectMapper(), true);
        StructuredDocument doc = StructuredDocument.builder()
                .append("a", "1")
                .append("n", 2)
                .appendPath("x.y", "z")
                .build();
        sink.accept(ConversionOutcome.success(0, doc));
        sink.accept(ConversionOutcome.failure(1, new ConversionException(1, "bad")));
        sink.close();
        assertEquals("{\"a\":\"1\",\"n\":2,\"x\":{\"y\":\"z\"}}\n", out.toString(StandardCharsets.UTF_8));
        assertEquals(1, sink.written());
        assertEquals(1, sink.failed());
    }
}
