/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.openshift.splunktoken.api.model.hive.SyncSet;
import io.openshift.splunktoken.api.model.hive.SyncSetList;
import io.vertx.core.Vertx;

/**
 * Operator for Hive {@code SyncSet}s
 */
public class SyncSetOperator extends CrdOperator<KubernetesClient, SyncSet, SyncSetList> {

    /**
     * Constructs the SyncSet operator
     *
     * @param vertx  The Vertx instance.
     * @param client The Kubernetes client.
     */
    public SyncSetOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, SyncSet.class, SyncSetList.class, SyncSet.RESOURCE_KIND);
    }

}
