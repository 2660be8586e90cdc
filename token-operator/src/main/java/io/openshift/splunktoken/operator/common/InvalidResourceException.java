/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

/**
 * Thrown when a watched resource cannot be reconciled because of its content
 */
public class InvalidResourceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Error message
     */
    public InvalidResourceException(String message) {
        super(message);
    }
}
