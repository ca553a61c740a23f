package io.textimport.metrics;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String RECORDS_READ = "pipeline.records.read";
    public static final String RECORDS_CONVERTED = "pipeline.records.converted";
    public static final String RECORDS_FAILED = "pipeline.records.failed";
    public static final String OUTCOMES_EMITTED = "pipeline.outcomes.emitted";
    public static final String CONVERT_TIME = "pipeline.convert.time";
    public static final String SINK_TIME = "pipeline.sink.time";
    public static final String MERGE_BUFFERED = "pipeline.merge.buffered";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }
}
