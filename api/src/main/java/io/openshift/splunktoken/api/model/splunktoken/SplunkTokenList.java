/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.splunktoken;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

public class SplunkTokenList extends DefaultKubernetesResourceList<SplunkToken> {
    private static final long serialVersionUID = 1L;
}
