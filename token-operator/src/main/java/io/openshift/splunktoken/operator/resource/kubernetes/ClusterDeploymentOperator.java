/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.openshift.splunktoken.api.model.hive.ClusterDeployment;
import io.openshift.splunktoken.api.model.hive.ClusterDeploymentList;
import io.vertx.core.Vertx;

/**
 * Operator for Hive {@code ClusterDeployment}s
 */
public class ClusterDeploymentOperator extends CrdOperator<KubernetesClient, ClusterDeployment, ClusterDeploymentList> {

    /**
     * Constructs the ClusterDeployment operator
     *
     * @param vertx  The Vertx instance.
     * @param client The Kubernetes client.
     */
    public ClusterDeploymentOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, ClusterDeployment.class, ClusterDeploymentList.class, ClusterDeployment.RESOURCE_KIND);
    }

}
