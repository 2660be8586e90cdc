/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

/**
 * Base class of the errors raised by the Splunk client
 */
public class SplunkClientException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Error message
     */
    public SplunkClientException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Error message
     * @param cause     Cause of the error
     */
    public SplunkClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
