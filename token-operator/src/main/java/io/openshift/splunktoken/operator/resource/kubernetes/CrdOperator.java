/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.vertx.core.Vertx;

/**
 * Operator for managing custom resources
 *
 * @param <C>   The type of client used to interact with Kubernetes
 * @param <T>   The custom resource type
 * @param <L>   The list variant of the custom resource type
 */
public class CrdOperator<C extends KubernetesClient, T extends CustomResource<?, ?>, L extends DefaultKubernetesResourceList<T>>
        extends AbstractNamespacedResourceOperator<C, T, L> {
    private final Class<T> cls;
    private final Class<L> listCls;

    /**
     * Constructor
     *
     * @param vertx         The Vertx instance
     * @param client        The Kubernetes client
     * @param cls           The class of the custom resource
     * @param listCls       The list variant of the custom resource class
     * @param kind          The kind of the custom resource
     */
    public CrdOperator(Vertx vertx, C client, Class<T> cls, Class<L> listCls, String kind) {
        super(vertx, client, kind);
        this.cls = cls;
        this.listCls = listCls;
    }

    @Override
    protected MixedOperation<T, L, Resource<T>> operation() {
        return client.resources(cls, listCls);
    }
}
