/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

/**
 * Error response returned by the Splunk Admin Config Service
 */
public class SplunkApiException extends SplunkClientException {
    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;
    private final String errorMessage;

    /**
     * Constructor
     *
     * @param statusCode    HTTP status code of the response
     * @param code          Error code from the response body
     * @param errorMessage  Error message from the response body
     */
    public SplunkApiException(int statusCode, String code, String errorMessage) {
        super(String.format("received error response %s: %s", code, errorMessage));
        this.statusCode = statusCode;
        this.code = code;
        this.errorMessage = errorMessage;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
