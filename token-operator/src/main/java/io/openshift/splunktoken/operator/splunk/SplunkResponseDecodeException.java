/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

/**
 * The response from Splunk could not be decoded
 */
public class SplunkResponseDecodeException extends SplunkClientException {
    private static final long serialVersionUID = 1L;

    public SplunkResponseDecodeException(String message) {
        super(message);
    }

    public SplunkResponseDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
