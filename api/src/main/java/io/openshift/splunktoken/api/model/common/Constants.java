/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.common;

/**
 * Constants shared by the custom resources
 */
public class Constants {
    /**
     * API group of the SplunkToken resource
     */
    public static final String RESOURCE_GROUP_NAME = "splunktoken.managed.openshift.io";

    /**
     * API version v1alpha1
     */
    public static final String V1ALPHA1 = "v1alpha1";

    /**
     * API group of the OpenShift Hive resources
     */
    public static final String HIVE_GROUP_NAME = "hive.openshift.io";

    /**
     * API version v1 used by Hive
     */
    public static final String V1 = "v1";

    /**
     * Value of the app.kubernetes.io/managed-by label set on the resources created by the operator
     */
    public static final String OPERATOR_NAME = "splunk-token-operator";

    private Constants() {
    }
}
