/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.micrometer.core.instrument.Timer;
import io.openshift.splunktoken.api.model.common.Constants;
import io.openshift.splunktoken.api.model.hive.ClusterDeployment;
import io.openshift.splunktoken.api.model.splunktoken.SplunkToken;
import io.openshift.splunktoken.operator.assembly.ClusterDeploymentReconciler;
import io.openshift.splunktoken.operator.assembly.SplunkTokenReconciler;
import io.openshift.splunktoken.operator.common.OperatorMetricsHolder;
import io.openshift.splunktoken.operator.common.Reconciliation;
import io.openshift.splunktoken.operator.common.ReconciliationLogger;
import io.openshift.splunktoken.operator.model.HecTokenSecret;
import io.openshift.splunktoken.operator.model.OwnerReferences;
import io.openshift.splunktoken.operator.resource.ResourceOperatorSupplier;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A verticle which watches ClusterDeployments, SplunkTokens and the Secrets created by the operator in one namespace
 * (or all namespaces) and triggers their reconciliation. All resources are also reconciled periodically.
 */
public class TokenOperator extends AbstractVerticle {
    private static final Logger LOGGER = LogManager.getLogger(TokenOperator.class);
    private static final ReconciliationLogger RECONCILIATION_LOGGER = ReconciliationLogger.create(TokenOperator.class);

    /* test */ static final String TRIGGER_WATCH = "watch";
    /* test */ static final String TRIGGER_TIMER = "timer";

    private final String namespace;
    private final TokenOperatorConfig config;
    private final ResourceOperatorSupplier resourceOperatorSupplier;
    private final ClusterDeploymentReconciler clusterDeploymentReconciler;
    private final SplunkTokenReconciler splunkTokenReconciler;
    private final OperatorMetricsHolder metrics;

    private final List<SharedIndexInformer<?>> informers = new ArrayList<>();
    private SharedIndexInformer<ClusterDeployment> clusterDeploymentInformer;
    private SharedIndexInformer<SplunkToken> splunkTokenInformer;
    private long reconcileTimer = -1;

    /**
     * Constructor
     *
     * @param namespace                     Namespace which this operator watches or * for all namespaces
     * @param config                        Operator configuration
     * @param resourceOperatorSupplier      Supplier of the resource operators
     * @param clusterDeploymentReconciler   Reconciler of the ClusterDeployments
     * @param splunkTokenReconciler         Reconciler of the SplunkTokens
     * @param metrics                       Reconciliation metrics
     */
    public TokenOperator(String namespace,
                         TokenOperatorConfig config,
                         ResourceOperatorSupplier resourceOperatorSupplier,
                         ClusterDeploymentReconciler clusterDeploymentReconciler,
                         SplunkTokenReconciler splunkTokenReconciler,
                         OperatorMetricsHolder metrics) {
        LOGGER.info("Creating TokenOperator for namespace {}", namespace);
        this.namespace = namespace;
        this.config = config;
        this.resourceOperatorSupplier = resourceOperatorSupplier;
        this.clusterDeploymentReconciler = clusterDeploymentReconciler;
        this.splunkTokenReconciler = splunkTokenReconciler;
        this.metrics = metrics;
    }

    @Override
    public void start(Promise<Void> start) {
        LOGGER.info("Starting TokenOperator for namespace {}", namespace);
        Context context = vertx.getOrCreateContext();
        long resyncMs = config.getFullReconciliationIntervalMs();

        clusterDeploymentInformer = resourceOperatorSupplier.clusterDeploymentOperator.informer(namespace, null, resyncMs);
        clusterDeploymentInformer.addEventHandler(new EventHandler<>(context,
                cd -> reconcileClusterDeployment(TRIGGER_WATCH, cd.getMetadata().getNamespace(), cd.getMetadata().getName()),
                null));

        splunkTokenInformer = resourceOperatorSupplier.splunkTokenOperator.informer(namespace, null, resyncMs);
        splunkTokenInformer.addEventHandler(new EventHandler<>(context, token -> {
            reconcileSplunkToken(TRIGGER_WATCH, token.getMetadata().getNamespace(), token.getMetadata().getName());
            reconcileOwningClusterDeployment(token);
        }, this::reconcileOwningClusterDeployment));

        SharedIndexInformer<Secret> secretInformer = resourceOperatorSupplier.secretOperations.informer(namespace,
                Map.of(HecTokenSecret.MANAGED_BY_LABEL, Constants.OPERATOR_NAME), resyncMs);
        secretInformer.addEventHandler(new EventHandler<>(context, null, secret -> {
            String owner = OwnerReferences.ownerName(secret, SplunkToken.RESOURCE_KIND);
            if (owner != null) {
                reconcileSplunkToken(TRIGGER_WATCH, secret.getMetadata().getNamespace(), owner);
            }
        }));

        informers.add(clusterDeploymentInformer);
        informers.add(splunkTokenInformer);
        informers.add(secretInformer);

        vertx.executeBlocking(() -> {
            for (SharedIndexInformer<?> informer : informers) {
                informer.run();
            }
            return null;
        }, false).onComplete(res -> {
            if (res.succeeded()) {
                LOGGER.info("Started informers for namespace {}", namespace);
                reconcileTimer = vertx.setPeriodic(config.getFullReconciliationIntervalMs(), id -> reconcileAll(TRIGGER_TIMER));
                start.complete();
            } else {
                LOGGER.error("Failed to start informers for namespace {}", namespace, res.cause());
                start.fail(res.cause());
            }
        });
    }

    @Override
    public void stop(Promise<Void> stop) {
        LOGGER.info("Stopping TokenOperator for namespace {}", namespace);
        vertx.cancelTimer(reconcileTimer);

        for (SharedIndexInformer<?> informer : informers) {
            informer.stop();
        }

        stop.complete();
    }

    /**
     * Reconciles all ClusterDeployments and SplunkTokens known to the informers
     *
     * @param trigger   What triggered the reconciliation
     */
    /* test */ void reconcileAll(String trigger) {
        LOGGER.info("Triggering periodic reconciliation for namespace {}", namespace);

        for (ClusterDeployment cd : clusterDeploymentInformer.getStore().list()) {
            reconcileClusterDeployment(trigger, cd.getMetadata().getNamespace(), cd.getMetadata().getName());
        }

        for (SplunkToken token : splunkTokenInformer.getStore().list()) {
            reconcileSplunkToken(trigger, token.getMetadata().getNamespace(), token.getMetadata().getName());
        }
    }

    /* test */ Future<Void> reconcileClusterDeployment(String trigger, String namespace, String name) {
        Reconciliation reconciliation = new Reconciliation(trigger, ClusterDeployment.RESOURCE_KIND, namespace, name);
        return withMetrics(reconciliation, clusterDeploymentReconciler::reconcile);
    }

    /* test */ Future<Void> reconcileSplunkToken(String trigger, String namespace, String name) {
        Reconciliation reconciliation = new Reconciliation(trigger, SplunkToken.RESOURCE_KIND, namespace, name);
        return withMetrics(reconciliation, splunkTokenReconciler::reconcile);
    }

    /**
     * A changed or removed SplunkToken is reported to its ClusterDeployment. This recreates the SplunkToken after
     * it was deleted for rotation.
     */
    private void reconcileOwningClusterDeployment(SplunkToken token) {
        String owner = OwnerReferences.ownerName(token, ClusterDeployment.RESOURCE_KIND);
        if (owner != null) {
            reconcileClusterDeployment(TRIGGER_WATCH, token.getMetadata().getNamespace(), owner);
        }
    }

    private Future<Void> withMetrics(Reconciliation reconciliation, Function<Reconciliation, Future<Void>> reconciler) {
        String kind = reconciliation.kind();

        metrics.reconciliationsCounter(kind).increment();
        Timer.Sample sample = Timer.start(metrics.metricsProvider().meterRegistry());

        Future<Void> result;
        try {
            result = reconciler.apply(reconciliation);
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        return result.onComplete(res -> {
            sample.stop(metrics.reconciliationsTimer(kind));

            if (res.succeeded()) {
                metrics.successfulReconciliationsCounter(kind).increment();
                RECONCILIATION_LOGGER.debugCr(reconciliation, "reconciled");
            } else {
                metrics.failedReconciliationsCounter(kind).increment();
                RECONCILIATION_LOGGER.errorCr(reconciliation, "failed to reconcile", res.cause());
            }
        });
    }

    /**
     * Dispatches the informer events to the Vert.x context of the verticle
     *
     * @param <T>   Type of the watched resource
     */
    private static class EventHandler<T extends HasMetadata> implements ResourceEventHandler<T> {
        private final Context context;
        private final Consumer<T> onChange;
        private final Consumer<T> onDelete;

        EventHandler(Context context, Consumer<T> onChange, Consumer<T> onDelete) {
            this.context = context;
            this.onChange = onChange;
            this.onDelete = onDelete;
        }

        @Override
        public void onAdd(T resource) {
            if (onChange != null) {
                context.runOnContext(v -> onChange.accept(resource));
            }
        }

        @Override
        public void onUpdate(T oldResource, T newResource) {
            if (onChange != null) {
                context.runOnContext(v -> onChange.accept(newResource));
            }
        }

        @Override
        public void onDelete(T resource, boolean deletedFinalStateUnknown) {
            if (onDelete != null) {
                context.runOnContext(v -> onDelete.accept(resource));
            }
        }
    }
}
