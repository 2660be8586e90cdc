/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openshift.splunktoken.operator.common.InvalidConfigurationException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Client for managing HEC tokens through the Splunk Admin Config Service (ACS) of a single Splunk Cloud stack.
 * The client authenticates with a JWT issued for the stack. Besides the underlying HTTP client it does not keep any
 * state, so a single instance can be shared by all reconciliations.
 */
public class SplunkAcsClient implements SplunkTokenManager, AutoCloseable {
    private static final Logger LOGGER = LogManager.getLogger(SplunkAcsClient.class);

    /**
     * Public ACS endpoint
     */
    public static final String DEFAULT_ACS_URL = "https://admin.splunk.com";

    /**
     * Default connect and idle timeout of the requests to ACS
     */
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    /* test */ static final String TOKEN_MANAGEMENT_PATH = "adminconfig/v2/inputs/http-event-collectors";
    /* test */ static final String MISSING_SPLUNK_ERROR = "missing Splunk instance name";
    /* test */ static final String MISSING_JWT_ERROR = "missing Splunk authentication token";

    private static final String APPLICATION_JSON = "application/json";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String collectionUrl;
    private final String authorization;
    private final long timeoutMs;
    private final HttpClient client;

    /**
     * Creates a client for the public ACS endpoint
     *
     * @param vertx             Vert.x instance
     * @param splunkInstance    Name of the Splunk Cloud stack
     * @param jwt               ACS authentication token
     */
    public SplunkAcsClient(Vertx vertx, String splunkInstance, String jwt) {
        this(vertx, DEFAULT_ACS_URL, splunkInstance, jwt, DEFAULT_TIMEOUT_MS);
    }

    /**
     * Constructor
     *
     * @param vertx             Vert.x instance
     * @param acsUrl            Base URL of the Admin Config Service
     * @param splunkInstance    Name of the Splunk Cloud stack
     * @param jwt               ACS authentication token
     * @param timeoutMs         Connect and idle timeout of each request
     */
    public SplunkAcsClient(Vertx vertx, String acsUrl, String splunkInstance, String jwt, long timeoutMs) {
        if (splunkInstance == null || splunkInstance.isEmpty()) {
            throw new InvalidConfigurationException(MISSING_SPLUNK_ERROR);
        }
        if (jwt == null || jwt.isEmpty()) {
            throw new InvalidConfigurationException(MISSING_JWT_ERROR);
        }

        this.collectionUrl = stripTrailingSlash(acsUrl) + "/" + encodePathSegment(splunkInstance) + "/" + TOKEN_MANAGEMENT_PATH;
        this.authorization = "Bearer " + jwt;
        this.timeoutMs = timeoutMs;
        this.client = vertx.createHttpClient(new HttpClientOptions()
                .setForceSni(true)
                .setConnectTimeout((int) timeoutMs));
    }

    /* test */ String collectionUrl() {
        return collectionUrl;
    }

    @Override
    public Future<HecToken> createToken(HecToken token) {
        HecToken desired = token.withDefaultIndexAllowed();
        String name = desired.getName();

        Buffer payload;
        try {
            payload = Buffer.buffer(MAPPER.writeValueAsBytes(desired.getSpec()));
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new SplunkClientException("Failed to encode the spec of HEC token " + name, e));
        }

        LOGGER.debug("Creating HEC token {}", name);
        return send(HttpMethod.POST, collectionUrl, payload)
                .compose(response -> {
                    if (response.statusCode() == 409) {
                        // Left over from an earlier attempt, the existing token is used
                        LOGGER.info("HEC token {} already exists, retrieving the existing token", name);
                    } else if (response.statusCode() >= 400) {
                        return Future.failedFuture(errorFrom(response));
                    }

                    // The creation response does not contain the token value
                    return readToken(name);
                });
    }

    @Override
    public Future<HecToken> readToken(String name) {
        LOGGER.debug("Reading HEC token {}", name);
        return send(HttpMethod.GET, tokenUrl(name), null)
                .compose(response -> {
                    if (response.statusCode() >= 400) {
                        return Future.failedFuture(errorFrom(response));
                    }

                    try {
                        HecTokenResponse tokenResponse = MAPPER.readValue(response.body().getBytes(), HecTokenResponse.class);
                        if (tokenResponse == null || tokenResponse.getData() == null) {
                            return Future.failedFuture(new SplunkResponseDecodeException("Response for HEC token " + name + " does not contain the token"));
                        }
                        return Future.succeededFuture(tokenResponse.getData());
                    } catch (IOException e) {
                        return Future.failedFuture(new SplunkResponseDecodeException("Failed to decode the response for HEC token " + name, e));
                    }
                });
    }

    @Override
    public Future<Void> deleteToken(String name) {
        LOGGER.debug("Deleting HEC token {}", name);
        return send(HttpMethod.DELETE, tokenUrl(name), null)
                .compose(response -> {
                    if (response.statusCode() == 404) {
                        LOGGER.info("HEC token {} does not exist in Splunk", name);
                        return Future.succeededFuture();
                    } else if (response.statusCode() >= 200 && response.statusCode() < 300) {
                        return Future.succeededFuture();
                    } else {
                        return Future.failedFuture(errorFrom(response));
                    }
                });
    }

    /**
     * Closes the underlying HTTP client
     */
    @Override
    public void close() {
        client.close();
    }

    private Future<AcsResponse> send(HttpMethod method, String url, Buffer payload) {
        RequestOptions options = new RequestOptions()
                .setMethod(method)
                .setAbsoluteURI(url)
                .setConnectTimeout(timeoutMs)
                .setIdleTimeout(timeoutMs)
                .putHeader(HttpHeaders.AUTHORIZATION, authorization);

        if (method != HttpMethod.DELETE) {
            options.putHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON);
        }

        return client.request(options)
                .compose(request -> payload != null ? request.send(payload) : request.send())
                .compose(response -> response.body().map(body -> new AcsResponse(response.statusCode(), body)))
                .recover(error -> Future.failedFuture(new SplunkTransportException(method + " request to " + url + " failed: " + error.getMessage(), error)));
    }

    private String tokenUrl(String name) {
        return collectionUrl + "/" + encodePathSegment(name);
    }

    private static SplunkClientException errorFrom(AcsResponse response) {
        try {
            AcsErrorResponse error = MAPPER.readValue(response.body().getBytes(), AcsErrorResponse.class);
            if (error == null) {
                return new SplunkResponseDecodeException("Received status code " + response.statusCode() + " without an error description");
            }
            return new SplunkApiException(response.statusCode(), error.code(), error.message());
        } catch (IOException e) {
            return new SplunkResponseDecodeException("Failed to decode the error response with status code " + response.statusCode(), e);
        }
    }

    private static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Status code and body of an ACS response
     */
    private record AcsResponse(int statusCode, Buffer body) {
    }
}
