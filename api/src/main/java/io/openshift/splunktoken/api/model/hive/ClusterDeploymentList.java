/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.hive;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

public class ClusterDeploymentList extends DefaultKubernetesResourceList<ClusterDeployment> {
    private static final long serialVersionUID = 1L;
}
