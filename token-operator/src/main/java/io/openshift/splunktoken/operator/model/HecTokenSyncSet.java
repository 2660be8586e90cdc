/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.model;

import io.fabric8.kubernetes.api.model.LocalObjectReference;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.SecretReference;
import io.openshift.splunktoken.api.model.common.Constants;
import io.openshift.splunktoken.api.model.hive.ClusterDeployment;
import io.openshift.splunktoken.api.model.hive.SecretMapping;
import io.openshift.splunktoken.api.model.hive.SyncSet;
import io.openshift.splunktoken.api.model.hive.SyncSetSpec;

import java.util.List;
import java.util.Map;

/**
 * Builds the Hive SyncSet which copies the HEC token Secret into the managed cluster
 */
public class HecTokenSyncSet {
    /**
     * Name of the SyncSet in the namespace of the ClusterDeployment
     */
    public static final String SYNCSET_NAME = "splunk-hec-token";

    private final String targetNamespace;
    private final String targetName;

    /**
     * Constructor
     *
     * @param targetNamespace   Namespace of the Secret in the managed cluster
     * @param targetName        Name of the Secret in the managed cluster
     */
    public HecTokenSyncSet(String targetNamespace, String targetName) {
        this.targetNamespace = targetNamespace;
        this.targetName = targetName;
    }

    /**
     * Builds the SyncSet owned by the ClusterDeployment
     *
     * @param owner     ClusterDeployment of the managed cluster
     *
     * @return  The SyncSet
     */
    public SyncSet build(ClusterDeployment owner) {
        String namespace = owner.getMetadata().getNamespace();

        SyncSetSpec spec = new SyncSetSpec();
        spec.setClusterDeploymentRefs(List.of(new LocalObjectReference(owner.getMetadata().getName())));
        spec.setResourceApplyMode(SyncSet.APPLY_MODE_SYNC);
        spec.setSecretMappings(List.of(new SecretMapping(
                new SecretReference(HecTokenSecret.SECRET_NAME, namespace),
                new SecretReference(targetName, targetNamespace))));

        SyncSet syncSet = new SyncSet();
        syncSet.setMetadata(new ObjectMetaBuilder()
                .withName(SYNCSET_NAME)
                .withNamespace(namespace)
                .withLabels(Map.of(HecTokenSecret.MANAGED_BY_LABEL, Constants.OPERATOR_NAME))
                .withOwnerReferences(OwnerReferences.ownerReference(owner))
                .build());
        syncSet.setSpec(spec);

        return syncSet;
    }
}
