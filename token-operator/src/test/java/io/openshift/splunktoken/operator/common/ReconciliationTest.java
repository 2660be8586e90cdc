/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

public class ReconciliationTest {
    @Test
    public void testMarkerAndToString() {
        Reconciliation reconciliation = new Reconciliation("watch", "SplunkToken", "uhc-production-1234", "cluster");

        assertThat(reconciliation.getMarker().getName(), is("SplunkToken(uhc-production-1234/cluster)"));
        assertThat(reconciliation.toString(), is("Reconciliation #" + reconciliation.id() + "(watch) SplunkToken(uhc-production-1234/cluster)"));
    }

    @Test
    public void testIdsAreUnique() {
        Reconciliation first = new Reconciliation("timer", "ClusterDeployment", "ns", "a");
        Reconciliation second = new Reconciliation("timer", "ClusterDeployment", "ns", "a");

        assertThat(first.id(), is(not(second.id())));
    }
}
