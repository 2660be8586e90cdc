/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Reconciliation metrics of the operator, tagged by the kind of the reconciled resource
 */
public class OperatorMetricsHolder {
    /**
     * Prefix used for the metrics
     */
    public static final String METRICS_PREFIX = "splunk_token_operator.";

    /* test */ static final String METRICS_RECONCILIATIONS = METRICS_PREFIX + "reconciliations";
    /* test */ static final String METRICS_RECONCILIATIONS_SUCCESSFUL = METRICS_RECONCILIATIONS + ".successful";
    /* test */ static final String METRICS_RECONCILIATIONS_FAILED = METRICS_RECONCILIATIONS + ".failed";
    /* test */ static final String METRICS_RECONCILIATIONS_DURATION = METRICS_RECONCILIATIONS + ".duration";

    private final MetricsProvider metricsProvider;

    /**
     * Constructor
     *
     * @param metricsProvider   Provider of the metrics
     */
    public OperatorMetricsHolder(MetricsProvider metricsProvider) {
        this.metricsProvider = metricsProvider;
    }

    /**
     * @return  The metrics provider
     */
    public MetricsProvider metricsProvider() {
        return metricsProvider;
    }

    /**
     * Counter of started reconciliations
     *
     * @param kind  Kind of the reconciled resource
     *
     * @return  The counter
     */
    public Counter reconciliationsCounter(String kind) {
        return metricsProvider.counter(METRICS_RECONCILIATIONS, "Number of reconciliations done by the operator", tags(kind));
    }

    /**
     * Counter of successful reconciliations
     *
     * @param kind  Kind of the reconciled resource
     *
     * @return  The counter
     */
    public Counter successfulReconciliationsCounter(String kind) {
        return metricsProvider.counter(METRICS_RECONCILIATIONS_SUCCESSFUL, "Number of reconciliations done by the operator which were successful", tags(kind));
    }

    /**
     * Counter of failed reconciliations
     *
     * @param kind  Kind of the reconciled resource
     *
     * @return  The counter
     */
    public Counter failedReconciliationsCounter(String kind) {
        return metricsProvider.counter(METRICS_RECONCILIATIONS_FAILED, "Number of reconciliations done by the operator which failed", tags(kind));
    }

    /**
     * Timer measuring the duration of the reconciliations
     *
     * @param kind  Kind of the reconciled resource
     *
     * @return  The timer
     */
    public Timer reconciliationsTimer(String kind) {
        return metricsProvider.timer(METRICS_RECONCILIATIONS_DURATION, "The time the reconciliation takes to complete", tags(kind));
    }

    private static Tags tags(String kind) {
        return Tags.of("kind", kind);
    }
}
