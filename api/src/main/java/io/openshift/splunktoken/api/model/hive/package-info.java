/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */

/**
 * Partial model of the OpenShift Hive resources used by the operator: ClusterDeployments are watched and SyncSets
 * are created to push the HEC token Secret into the managed clusters.
 */
package io.openshift.splunktoken.api.model.hive;
