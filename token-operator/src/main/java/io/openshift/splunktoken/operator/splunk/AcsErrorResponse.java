/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of an ACS error response
 *
 * @param code      ACS error code, for example 404-http-event-collector-not-found
 * @param message   Human readable error message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record AcsErrorResponse(String code, String message) {
}
