/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

/**
 * The request to Splunk failed before a response was received, for example because of a connection error or a
 * timeout
 */
public class SplunkTransportException extends SplunkClientException {
    private static final long serialVersionUID = 1L;

    public SplunkTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
