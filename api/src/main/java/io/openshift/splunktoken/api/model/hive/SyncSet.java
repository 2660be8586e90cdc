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
 * Hive SyncSet used to copy the HEC token Secret from the Hive namespace of the cluster into the managed cluster
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Version(SyncSet.VERSION)
@Group(SyncSet.GROUP)
@Plural(SyncSet.RESOURCE_PLURAL)
public class SyncSet extends CustomResource<SyncSetSpec, Void> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = Constants.HIVE_GROUP_NAME;
    public static final String VERSION = Constants.V1;

    public static final String RESOURCE_KIND = "SyncSet";
    public static final String RESOURCE_PLURAL = "syncsets";

    /**
     * Resources are created or updated on the managed cluster and deleted when they are removed from the SyncSet
     */
    public static final String APPLY_MODE_SYNC = "Sync";
}
