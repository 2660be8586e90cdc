/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.FilterWatchListDeletable;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.openshift.splunktoken.operator.common.Reconciliation;
import io.openshift.splunktoken.operator.common.ReconciliationLogger;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.util.List;
import java.util.Map;

/**
 * Abstract resource creation, update, read and deletion for namespaced Kubernetes resources. The blocking calls of the
 * Kubernetes client are run on the Vert.x worker pool and their results are returned as futures.
 *
 * @param <C>   The type of client used to interact with Kubernetes
 * @param <T>   The Kubernetes resource type
 * @param <L>   The list variant of the Kubernetes resource type
 */
public abstract class AbstractNamespacedResourceOperator<C extends KubernetesClient, T extends HasMetadata, L extends KubernetesResourceList<T>> {
    /**
     * Namespace value used to operate on all namespaces
     */
    public static final String ANY_NAMESPACE = "*";

    protected final ReconciliationLogger logger = ReconciliationLogger.create(getClass());

    protected final Vertx vertx;
    protected final C client;
    protected final String resourceKind;

    /**
     * Constructor
     *
     * @param vertx         The Vertx instance
     * @param client        The Kubernetes client
     * @param resourceKind  The kind of Kubernetes resource (used for logging)
     */
    protected AbstractNamespacedResourceOperator(Vertx vertx, C client, String resourceKind) {
        this.vertx = vertx;
        this.client = client;
        this.resourceKind = resourceKind;
    }

    /**
     * @return  The fabric8 operation for this resource type
     */
    protected abstract MixedOperation<T, L, Resource<T>> operation();

    /**
     * @return  The kind of the resources handled by this operator
     */
    public String resourceKind() {
        return resourceKind;
    }

    /**
     * Synchronously gets the resource
     *
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     *
     * @return  The resource or null when it does not exist
     */
    public T get(String namespace, String name) {
        return operation().inNamespace(namespace).withName(name).get();
    }

    /**
     * Asynchronously gets the resource
     *
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     *
     * @return  Future with the resource or with null when it does not exist
     */
    public Future<T> getAsync(String namespace, String name) {
        return vertx.executeBlocking(() -> get(namespace, name), false);
    }

    /**
     * Asynchronously lists the resources
     *
     * @param namespace Namespace of the resources or {@link #ANY_NAMESPACE} for all namespaces
     * @param labels    Labels the resources have to match. Null or empty map matches all resources.
     *
     * @return  Future with the list of resources
     */
    public Future<List<T>> listAsync(String namespace, Map<String, String> labels) {
        return vertx.executeBlocking(() -> selection(namespace, labels).list().getItems(), false);
    }

    /**
     * Asynchronously creates the resource
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          Resource to create
     *
     * @return  Future with the created resource
     */
    public Future<T> createAsync(Reconciliation reconciliation, T resource) {
        String namespace = resource.getMetadata().getNamespace();
        String name = resource.getMetadata().getName();

        return vertx.executeBlocking(() -> {
            logger.debugCr(reconciliation, "{} {}/{} is being created", resourceKind, namespace, name);
            T created = operation().inNamespace(namespace).resource(resource).create();
            logger.debugCr(reconciliation, "{} {}/{} has been created", resourceKind, namespace, name);
            return created;
        }, false);
    }

    /**
     * Asynchronously updates the resource. When the resource carries a resource version, the update fails with a
     * conflict if the resource was modified in the meantime.
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          Desired state of the resource
     *
     * @return  Future with the updated resource
     */
    public Future<T> updateAsync(Reconciliation reconciliation, T resource) {
        String namespace = resource.getMetadata().getNamespace();
        String name = resource.getMetadata().getName();

        return vertx.executeBlocking(() -> {
            logger.debugCr(reconciliation, "{} {}/{} is being updated", resourceKind, namespace, name);
            T updated = operation().inNamespace(namespace).resource(resource).update();
            logger.debugCr(reconciliation, "{} {}/{} has been updated", resourceKind, namespace, name);
            return updated;
        }, false);
    }

    /**
     * Asynchronously deletes the resource with background propagation. Deleting a resource which does not exist
     * succeeds.
     *
     * @param reconciliation    Reconciliation marker
     * @param namespace         Namespace of the resource
     * @param name              Name of the resource
     *
     * @return  Future which completes when the deletion request was accepted
     */
    public Future<Void> deleteAsync(Reconciliation reconciliation, String namespace, String name) {
        return vertx.executeBlocking(() -> {
            logger.debugCr(reconciliation, "{} {}/{} is being deleted", resourceKind, namespace, name);
            operation().inNamespace(namespace).withName(name)
                    .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                    .delete();
            logger.debugCr(reconciliation, "{} {}/{} has been deleted", resourceKind, namespace, name);
            return null;
        }, false);
    }

    /**
     * Creates an informer for the resources. The informer is not started.
     *
     * @param namespace     Namespace of the resources or {@link #ANY_NAMESPACE} for all namespaces
     * @param labels        Labels the resources have to match. Null or empty map matches all resources.
     * @param resyncMs      Resync period of the informer in milliseconds
     *
     * @return  Informer for the resources
     */
    public SharedIndexInformer<T> informer(String namespace, Map<String, String> labels, long resyncMs) {
        return selection(namespace, labels).runnableInformer(resyncMs);
    }

    private FilterWatchListDeletable<T, L, Resource<T>> selection(String namespace, Map<String, String> labels) {
        FilterWatchListDeletable<T, L, Resource<T>> selection = ANY_NAMESPACE.equals(namespace)
                ? operation().inAnyNamespace()
                : operation().inNamespace(namespace);

        if (labels != null && !labels.isEmpty()) {
            selection = selection.withLabels(labels);
        }

        return selection;
    }
}
