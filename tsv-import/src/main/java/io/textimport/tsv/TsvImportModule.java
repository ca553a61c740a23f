package io.textimport.tsv;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.textimport.core.RecordConverter;
import io.textimport.core.StructuredDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class TsvImportModule extends AbstractModule {
    private final TsvImportConfig config;

    public TsvImportModule(TsvImportConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(TsvOptions.class).toInstance(config.options());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton RecordConverter<StructuredDocument> converter(TsvOptions options) { return new TsvRecordConverter(options); }

    @Provides @Singleton JsonLinesSink sink(ObjectMapper mapper) throws IOException {
        Path out = config.out();
        if (out == null) return new JsonLinesSink(System.out, mapper, false);
        if (out.getParent() != null) Files.createDirectories(out.getParent());
        return new JsonLinesSink(Files.newOutputStream(out), mapper, true);
    }
}
