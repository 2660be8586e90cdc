/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.hive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;
import io.openshift.splunktoken.api.model.common.Constants;

/**
 * Hive ClusterDeployment. The operator only reads its metadata, the spec and status are mapped partially and the
 * remaining fields are preserved as additional properties.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Version(ClusterDeployment.VERSION)
@Group(ClusterDeployment.GROUP)
@Plural(ClusterDeployment.RESOURCE_PLURAL)
public class ClusterDeployment extends CustomResource<ClusterDeploymentSpec, ClusterDeploymentStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = Constants.HIVE_GROUP_NAME;
    public static final String VERSION = Constants.V1;

    public static final String RESOURCE_KIND = "ClusterDeployment";
    public static final String RESOURCE_PLURAL = "clusterdeployments";

    /**
     * Label carrying the OCM ID of the cluster
     */
    public static final String CLUSTER_ID_LABEL = "api.openshift.com/id";

    /**
     * Label distinguishing management clusters of hosted control planes from classic clusters
     */
    public static final String CLUSTER_TYPE_LABEL = "ext-hypershift.openshift.io/cluster-type";

    /**
     * Value of the {@link #CLUSTER_TYPE_LABEL} label used by management clusters
     */
    public static final String MANAGEMENT_CLUSTER_TYPE = "management-cluster";
}
