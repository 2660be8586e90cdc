/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

/**
 * Thrown when a resource does not have a label which is required to reconcile it
 */
public class MissingLabelException extends InvalidResourceException {
    private static final long serialVersionUID = 1L;

    private final String label;

    /**
     * Constructor
     *
     * @param label         The missing label
     * @param resourceKind  Kind of the resource without the label
     */
    public MissingLabelException(String label, String resourceKind) {
        super("label " + label + " not found on " + resourceKind);
        this.label = label;
    }

    /**
     * @return  The missing label
     */
    public String getLabel() {
        return label;
    }
}
