/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.splunktoken;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;
import io.openshift.splunktoken.api.model.common.Constants;

/**
 * Desired Splunk HEC token of a single cluster. There is one SplunkToken named {@link #TOKEN_NAME} in the namespace
 * of each ClusterDeployment. The token value itself is never stored here, only in the Secret owned by this resource.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Version(SplunkToken.VERSION)
@Group(SplunkToken.GROUP)
@Plural(SplunkToken.RESOURCE_PLURAL)
@Singular(SplunkToken.RESOURCE_SINGULAR)
public class SplunkToken extends CustomResource<SplunkTokenSpec, Void> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = Constants.RESOURCE_GROUP_NAME;
    public static final String VERSION = Constants.V1ALPHA1;

    public static final String SCOPE = "Namespaced";
    public static final String RESOURCE_KIND = "SplunkToken";
    public static final String RESOURCE_LIST_KIND = RESOURCE_KIND + "List";
    public static final String RESOURCE_PLURAL = "splunktokens";
    public static final String RESOURCE_SINGULAR = "splunktoken";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;

    /**
     * Name of the SplunkToken resource within a cluster namespace
     */
    public static final String TOKEN_NAME = "cluster";

    /**
     * Finalizer which blocks the deletion of the SplunkToken until the HEC token was removed from Splunk
     */
    public static final String FINALIZER = GROUP + "/finalizer";
}
