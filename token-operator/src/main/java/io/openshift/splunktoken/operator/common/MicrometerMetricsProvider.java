/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Metrics provider backed by a Micrometer registry
 */
public class MicrometerMetricsProvider implements MetricsProvider {
    private final MeterRegistry metrics;

    /**
     * Constructor
     *
     * @param metrics   Meter registry
     */
    public MicrometerMetricsProvider(MeterRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public MeterRegistry meterRegistry() {
        return metrics;
    }

    @Override
    public Counter counter(String name, String description, Tags tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags)
                .register(metrics);
    }

    @Override
    public Timer timer(String name, String description, Tags tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tags)
                .register(metrics);
    }
}
