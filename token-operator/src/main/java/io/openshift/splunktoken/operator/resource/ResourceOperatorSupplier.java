/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.openshift.splunktoken.operator.resource.kubernetes.ClusterDeploymentOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SecretOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SplunkTokenOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SyncSetOperator;
import io.vertx.core.Vertx;

/**
 * Class holding the various resource operator providers used by the reconcilers
 */
public class ResourceOperatorSupplier {
    /**
     * Secret operator
     */
    public final SecretOperator secretOperations;

    /**
     * SplunkToken operator
     */
    public final SplunkTokenOperator splunkTokenOperator;

    /**
     * ClusterDeployment operator
     */
    public final ClusterDeploymentOperator clusterDeploymentOperator;

    /**
     * SyncSet operator
     */
    public final SyncSetOperator syncSetOperator;

    /**
     * Constructor
     *
     * @param vertx     Vert.x instance
     * @param client    Kubernetes client
     */
    public ResourceOperatorSupplier(Vertx vertx, KubernetesClient client) {
        this(new SecretOperator(vertx, client),
                new SplunkTokenOperator(vertx, client),
                new ClusterDeploymentOperator(vertx, client),
                new SyncSetOperator(vertx, client));
    }

    /**
     * Constructor used in tests
     *
     * @param secretOperations          Secret operator
     * @param splunkTokenOperator       SplunkToken operator
     * @param clusterDeploymentOperator ClusterDeployment operator
     * @param syncSetOperator           SyncSet operator
     */
    public ResourceOperatorSupplier(SecretOperator secretOperations,
                                    SplunkTokenOperator splunkTokenOperator,
                                    ClusterDeploymentOperator clusterDeploymentOperator,
                                    SyncSetOperator syncSetOperator) {
        this.secretOperations = secretOperations;
        this.splunkTokenOperator = splunkTokenOperator;
        this.clusterDeploymentOperator = clusterDeploymentOperator;
        this.syncSetOperator = syncSetOperator;
    }
}
