/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.assembly;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.openshift.splunktoken.api.model.hive.ClusterDeployment;
import io.openshift.splunktoken.api.model.splunktoken.SplunkToken;
import io.openshift.splunktoken.api.model.splunktoken.SplunkTokenSpec;
import io.openshift.splunktoken.operator.SplunkIndexes;
import io.openshift.splunktoken.operator.TokenOperatorConfig;
import io.openshift.splunktoken.operator.common.MissingLabelException;
import io.openshift.splunktoken.operator.common.Reconciliation;
import io.openshift.splunktoken.operator.common.ReconciliationLogger;
import io.openshift.splunktoken.operator.model.HecTokenSyncSet;
import io.openshift.splunktoken.operator.model.OwnerReferences;
import io.openshift.splunktoken.operator.resource.ResourceOperatorSupplier;
import io.openshift.splunktoken.operator.resource.kubernetes.ClusterDeploymentOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SplunkTokenOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SyncSetOperator;
import io.vertx.core.Future;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Makes sure every ClusterDeployment has a SplunkToken with the indexes matching the type of the cluster. When
 * enabled, it also creates the SyncSet which copies the HEC token Secret into the managed cluster.
 */
public class ClusterDeploymentReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ClusterDeploymentReconciler.class);

    private final ClusterDeploymentOperator clusterDeploymentOperator;
    private final SplunkTokenOperator tokenOperator;
    private final SyncSetOperator syncSetOperator;
    private final SplunkIndexes classicIndexes;
    private final SplunkIndexes hcpIndexes;
    private final boolean syncSetEnabled;
    private final HecTokenSyncSet syncSetModel;

    /**
     * Constructor
     *
     * @param config    Operator configuration
     * @param supplier  Supplier of the resource operators
     */
    public ClusterDeploymentReconciler(TokenOperatorConfig config, ResourceOperatorSupplier supplier) {
        this.clusterDeploymentOperator = supplier.clusterDeploymentOperator;
        this.tokenOperator = supplier.splunkTokenOperator;
        this.syncSetOperator = supplier.syncSetOperator;
        this.classicIndexes = config.getClassicIndexes();
        this.hcpIndexes = config.getHcpIndexes();
        this.syncSetEnabled = config.isSyncSetEnabled();
        this.syncSetModel = new HecTokenSyncSet(config.getSyncSetTargetNamespace(), config.getSyncSetTargetName());
    }

    /**
     * Reconciles the ClusterDeployment identified by the reconciliation
     *
     * @param reconciliation    Reconciliation with the namespace and name of the ClusterDeployment
     *
     * @return  Future which completes when the reconciliation is done
     */
    public Future<Void> reconcile(Reconciliation reconciliation) {
        return clusterDeploymentOperator.getAsync(reconciliation.namespace(), reconciliation.name())
                .compose(clusterDeployment -> {
                    if (clusterDeployment == null) {
                        LOGGER.infoCr(reconciliation, "ClusterDeployment not found");
                        return Future.succeededFuture();
                    }

                    Map<String, String> labels = clusterDeployment.getMetadata().getLabels();
                    String clusterId = labels != null ? labels.get(ClusterDeployment.CLUSTER_ID_LABEL) : null;
                    if (clusterId == null || clusterId.isEmpty()) {
                        return Future.failedFuture(new MissingLabelException(ClusterDeployment.CLUSTER_ID_LABEL, ClusterDeployment.RESOURCE_KIND));
                    }

                    SplunkIndexes indexes = indexesFor(reconciliation, clusterDeployment);

                    return reconcileSplunkToken(reconciliation, clusterDeployment, clusterId, indexes)
                            .compose(i -> reconcileSyncSet(reconciliation, clusterDeployment));
                });
    }

    /* test */ SplunkIndexes indexesFor(Reconciliation reconciliation, ClusterDeployment clusterDeployment) {
        Map<String, String> labels = clusterDeployment.getMetadata().getLabels();
        String clusterType = labels != null ? labels.get(ClusterDeployment.CLUSTER_TYPE_LABEL) : null;

        if (ClusterDeployment.MANAGEMENT_CLUSTER_TYPE.equals(clusterType)) {
            LOGGER.debugCr(reconciliation, "Using the indexes of management clusters");
            return hcpIndexes;
        } else {
            LOGGER.debugCr(reconciliation, "Using the indexes of classic clusters");
            return classicIndexes;
        }
    }

    private Future<Void> reconcileSplunkToken(Reconciliation reconciliation, ClusterDeployment clusterDeployment, String clusterId, SplunkIndexes indexes) {
        String namespace = reconciliation.namespace();

        return tokenOperator.getAsync(namespace, SplunkToken.TOKEN_NAME)
                .compose(current -> {
                    if (current == null) {
                        LOGGER.infoCr(reconciliation, "SplunkToken {} does not exist, creating it", SplunkToken.TOKEN_NAME);

                        SplunkToken token = new SplunkToken();
                        token.setMetadata(new ObjectMetaBuilder()
                                .withName(SplunkToken.TOKEN_NAME)
                                .withNamespace(namespace)
                                .withOwnerReferences(OwnerReferences.ownerReference(clusterDeployment))
                                .build());
                        token.setSpec(new SplunkTokenSpec(clusterId, indexes.defaultIndex(), indexes.allowedIndexes()));

                        return tokenOperator.createAsync(reconciliation, token).mapEmpty();
                    } else if (indexesUnchanged(current.getSpec(), indexes)) {
                        LOGGER.debugCr(reconciliation, "SplunkToken {} is up to date", SplunkToken.TOKEN_NAME);
                        return Future.succeededFuture();
                    } else {
                        LOGGER.infoCr(reconciliation, "Indexes of SplunkToken {} changed, updating it", SplunkToken.TOKEN_NAME);

                        current.setSpec(new SplunkTokenSpec(clusterId, indexes.defaultIndex(), indexes.allowedIndexes()));
                        OwnerReferences.setOwnerReference(current, OwnerReferences.ownerReference(clusterDeployment));

                        return tokenOperator.updateAsync(reconciliation, current).mapEmpty();
                    }
                });
    }

    private Future<Void> reconcileSyncSet(Reconciliation reconciliation, ClusterDeployment clusterDeployment) {
        if (!syncSetEnabled) {
            return Future.succeededFuture();
        }

        return syncSetOperator.getAsync(reconciliation.namespace(), HecTokenSyncSet.SYNCSET_NAME)
                .compose(current -> {
                    if (current != null) {
                        return Future.succeededFuture();
                    }

                    LOGGER.infoCr(reconciliation, "Creating SyncSet {}", HecTokenSyncSet.SYNCSET_NAME);
                    return syncSetOperator.createAsync(reconciliation, syncSetModel.build(clusterDeployment)).mapEmpty();
                });
    }

    /**
     * Only the indexes are compared. Missing values are equal to empty ones and the order of the allowed indexes
     * matters.
     */
    /* test */ static boolean indexesUnchanged(SplunkTokenSpec spec, SplunkIndexes desired) {
        if (spec == null) {
            return false;
        }

        return Objects.equals(emptyToNull(spec.getDefaultIndex()), emptyToNull(desired.defaultIndex()))
                && nullToEmpty(spec.getAllowedIndexes()).equals(nullToEmpty(desired.allowedIndexes()));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static List<String> nullToEmpty(List<String> value) {
        return value != null ? value : List.of();
    }
}
