/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator;

import java.util.List;

/**
 * Splunk indexes assigned to the HEC tokens of one type of cluster
 *
 * @param defaultIndex      Index used when the event does not specify one. Null when not configured.
 * @param allowedIndexes    Ordered list of indexes the token can write to
 */
public record SplunkIndexes(String defaultIndex, List<String> allowedIndexes) {
    /**
     * Constructor
     *
     * @param defaultIndex      Index used when the event does not specify one. Null when not configured.
     * @param allowedIndexes    Ordered list of indexes the token can write to
     */
    public SplunkIndexes {
        allowedIndexes = allowedIndexes != null ? List.copyOf(allowedIndexes) : List.of();
    }
}
