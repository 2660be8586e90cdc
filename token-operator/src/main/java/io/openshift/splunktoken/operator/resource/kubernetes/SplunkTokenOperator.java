/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.openshift.splunktoken.api.model.splunktoken.SplunkToken;
import io.openshift.splunktoken.api.model.splunktoken.SplunkTokenList;
import io.vertx.core.Vertx;

/**
 * Operator for {@code SplunkToken}s
 */
public class SplunkTokenOperator extends CrdOperator<KubernetesClient, SplunkToken, SplunkTokenList> {

    /**
     * Constructs the SplunkToken operator
     *
     * @param vertx  The Vertx instance.
     * @param client The Kubernetes client.
     */
    public SplunkTokenOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, SplunkToken.class, SplunkTokenList.class, SplunkToken.RESOURCE_KIND);
    }

}
