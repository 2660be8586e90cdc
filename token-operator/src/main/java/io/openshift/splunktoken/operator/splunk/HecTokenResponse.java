/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the ACS response to reading a HEC token
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class HecTokenResponse {
    @JsonProperty("http-event-collector")
    private HecToken data;

    HecToken getData() {
        return data;
    }
}
