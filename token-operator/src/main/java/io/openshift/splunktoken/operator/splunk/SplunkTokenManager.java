/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

import io.vertx.core.Future;

/**
 * Operations on Splunk HTTP Event Collector tokens needed by the operator
 */
public interface SplunkTokenManager {
    /**
     * Creates the HEC token in Splunk. When a token with the same name already exists, the existing token is
     * returned instead.
     *
     * @param token     Token to create. Only its spec is used.
     *
     * @return  Future with the token as stored in Splunk, including its value
     */
    Future<HecToken> createToken(HecToken token);

    /**
     * Reads a HEC token from Splunk
     *
     * @param name  Name of the token
     *
     * @return  Future with the token, including its value
     */
    Future<HecToken> readToken(String name);

    /**
     * Deletes a HEC token from Splunk. Deleting a token which does not exist succeeds.
     *
     * @param name  Name of the token
     *
     * @return  Future which completes when the token is deleted
     */
    Future<Void> deleteToken(String name);
}
