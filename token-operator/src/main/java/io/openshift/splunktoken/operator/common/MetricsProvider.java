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
 * Provides the metrics used by the operator
 */
public interface MetricsProvider {
    /**
     * @return  The registry holding all the metrics
     */
    MeterRegistry meterRegistry();

    /**
     * Creates or returns an existing counter
     *
     * @param name          Name of the metric
     * @param description   Description of the metric
     * @param tags          Tags of the metric
     *
     * @return  The counter
     */
    Counter counter(String name, String description, Tags tags);

    /**
     * Creates or returns an existing timer
     *
     * @param name          Name of the metric
     * @param description   Description of the metric
     * @param tags          Tags of the metric
     *
     * @return  The timer
     */
    Timer timer(String name, String description, Tags tags);
}
