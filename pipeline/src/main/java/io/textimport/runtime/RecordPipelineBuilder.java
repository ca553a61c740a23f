package io.textimport.runtime;

import com.codahale.metrics.MetricRegistry;
import io.textimport.config.PipelineConfig;
import io.textimport.core.RecordConverter;
import io.textimport.core.RecordSource;
import io.textimport.metrics.Metrics;

import java.util.Objects;

public class RecordPipelineBuilder<D> {
    private RecordSource source;
    private RecordConverter<D> converter;
    private int workers = Runtime.getRuntime().availableProcessors();
    private boolean ordered = false;
    private ConversionFailurePolicy failurePolicy = ConversionFailurePolicy.CONTINUE;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public RecordPipelineBuilder<D> source(RecordSource s) { this.source = s; return this; }
    public RecordPipelineBuilder<D> converter(RecordConverter<D> c) { this.converter = c; return this; }
    public RecordPipelineBuilder<D> workers(int w) { this.workers = Math.max(1, w); return this; }
    public RecordPipelineBuilder<D> ordered(boolean o) { this.ordered = o; return this; }
    public RecordPipelineBuilder<D> failurePolicy(ConversionFailurePolicy p) { this.failurePolicy = p; return this; }
    public RecordPipelineBuilder<D> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public RecordPipelineBuilder<D> config(PipelineConfig cfg) {
        return workers(cfg.workers()).ordered(cfg.ordered()).failurePolicy(cfg.failurePolicy());
    }

    public RecordPipeline<D> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(converter, "converter");
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        Objects.requireNonNull(metricRegistry, "metricRegistry");
        return new RecordPipeline<>(source, converter, workers, ordered, failurePolicy, new Metrics(metricRegistry));
    }
}
