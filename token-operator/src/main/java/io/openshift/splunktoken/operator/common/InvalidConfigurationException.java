/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

/**
 * Thrown when the operator configuration is missing a required value or contains an invalid one
 */
public class InvalidConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Error message
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Error message
     * @param cause     Cause of the error
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
