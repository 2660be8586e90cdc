/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator;

import io.openshift.splunktoken.operator.common.InvalidConfigurationException;
import io.openshift.splunktoken.operator.resource.kubernetes.AbstractNamespacedResourceOperator;
import io.openshift.splunktoken.operator.splunk.SplunkAcsClient;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Configuration of the Splunk Token Operator. It is built from the environment variables of the operator
 * container.
 */
public class TokenOperatorConfig {
    /**
     * Name of the Splunk Cloud stack
     */
    public static final String SPLUNK_INSTANCE = "SPLUNK_INSTANCE";

    /**
     * JWT used to authenticate against the Splunk Admin Config Service
     */
    public static final String SPLUNK_AUTH_TOKEN = "SPLUNK_AUTH_TOKEN";

    /**
     * Base URL of the Splunk Admin Config Service
     */
    public static final String SPLUNK_ACS_URL = "SPLUNK_ACS_URL";

    /**
     * Domain of the Splunk Cloud HEC endpoint
     */
    public static final String SPLUNK_COLLECTOR_DOMAIN = "SPLUNK_COLLECTOR_DOMAIN";

    /**
     * Maximum age of a HEC token before it is rotated, as an ISO-8601 duration
     */
    public static final String SPLUNK_TOKEN_MAX_AGE = "SPLUNK_TOKEN_MAX_AGE";

    public static final String SPLUNK_CLASSIC_DEFAULT_INDEX = "SPLUNK_CLASSIC_DEFAULT_INDEX";
    public static final String SPLUNK_CLASSIC_ALLOWED_INDEXES = "SPLUNK_CLASSIC_ALLOWED_INDEXES";
    public static final String SPLUNK_HCP_DEFAULT_INDEX = "SPLUNK_HCP_DEFAULT_INDEX";
    public static final String SPLUNK_HCP_ALLOWED_INDEXES = "SPLUNK_HCP_ALLOWED_INDEXES";

    /**
     * Comma separated list of watched namespaces or {@code *} for all namespaces
     */
    public static final String SPLUNK_TOKEN_OPERATOR_NAMESPACES = "SPLUNK_TOKEN_OPERATOR_NAMESPACES";

    /**
     * Interval of the periodic reconciliation of all resources in milliseconds
     */
    public static final String SPLUNK_TOKEN_OPERATOR_FULL_RECONCILIATION_INTERVAL_MS = "SPLUNK_TOKEN_OPERATOR_FULL_RECONCILIATION_INTERVAL_MS";

    /**
     * Connect and idle timeout of the requests to Splunk in milliseconds
     */
    public static final String SPLUNK_TOKEN_OPERATOR_OPERATION_TIMEOUT_MS = "SPLUNK_TOKEN_OPERATOR_OPERATION_TIMEOUT_MS";

    /**
     * Enables the creation of the SyncSet copying the HEC token Secret into the managed cluster
     */
    public static final String SPLUNK_TOKEN_OPERATOR_SYNCSET_ENABLED = "SPLUNK_TOKEN_OPERATOR_SYNCSET_ENABLED";
    public static final String SPLUNK_TOKEN_OPERATOR_SYNCSET_TARGET_NAMESPACE = "SPLUNK_TOKEN_OPERATOR_SYNCSET_TARGET_NAMESPACE";
    public static final String SPLUNK_TOKEN_OPERATOR_SYNCSET_TARGET_NAME = "SPLUNK_TOKEN_OPERATOR_SYNCSET_TARGET_NAME";

    public static final String DEFAULT_COLLECTOR_DOMAIN = "splunkcloud.com";
    public static final Duration DEFAULT_TOKEN_MAX_AGE = Duration.ofDays(30);
    public static final long DEFAULT_FULL_RECONCILIATION_INTERVAL_MS = 300_000L;
    public static final long DEFAULT_OPERATION_TIMEOUT_MS = SplunkAcsClient.DEFAULT_TIMEOUT_MS;
    public static final String DEFAULT_SYNCSET_TARGET_NAMESPACE = "openshift-security";
    public static final String DEFAULT_SYNCSET_TARGET_NAME = "splunk-hec-token";

    private final String splunkInstance;
    private final String splunkAuthToken;
    private final String acsUrl;
    private final String collectorDomain;
    private final Duration tokenMaxAge;
    private final SplunkIndexes classicIndexes;
    private final SplunkIndexes hcpIndexes;
    private final Set<String> namespaces;
    private final long fullReconciliationIntervalMs;
    private final long operationTimeoutMs;
    private final boolean syncSetEnabled;
    private final String syncSetTargetNamespace;
    private final String syncSetTargetName;

    /**
     * Constructor
     *
     * @param splunkInstance                Name of the Splunk Cloud stack
     * @param splunkAuthToken               ACS authentication token
     * @param acsUrl                        Base URL of the Admin Config Service
     * @param collectorDomain               Domain of the HEC endpoint
     * @param tokenMaxAge                   Age after which HEC tokens are rotated
     * @param classicIndexes                Indexes of the classic clusters
     * @param hcpIndexes                    Indexes of the management clusters of hosted control planes
     * @param namespaces                    Watched namespaces
     * @param fullReconciliationIntervalMs  Interval of the periodic reconciliation
     * @param operationTimeoutMs            Timeout of the requests to Splunk
     * @param syncSetEnabled                Whether the SyncSets should be created
     * @param syncSetTargetNamespace        Namespace of the Secret in the managed cluster
     * @param syncSetTargetName             Name of the Secret in the managed cluster
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public TokenOperatorConfig(String splunkInstance,
                               String splunkAuthToken,
                               String acsUrl,
                               String collectorDomain,
                               Duration tokenMaxAge,
                               SplunkIndexes classicIndexes,
                               SplunkIndexes hcpIndexes,
                               Set<String> namespaces,
                               long fullReconciliationIntervalMs,
                               long operationTimeoutMs,
                               boolean syncSetEnabled,
                               String syncSetTargetNamespace,
                               String syncSetTargetName) {
        this.splunkInstance = splunkInstance;
        this.splunkAuthToken = splunkAuthToken;
        this.acsUrl = acsUrl;
        this.collectorDomain = collectorDomain;
        this.tokenMaxAge = tokenMaxAge;
        this.classicIndexes = classicIndexes;
        this.hcpIndexes = hcpIndexes;
        this.namespaces = Set.copyOf(namespaces);
        this.fullReconciliationIntervalMs = fullReconciliationIntervalMs;
        this.operationTimeoutMs = operationTimeoutMs;
        this.syncSetEnabled = syncSetEnabled;
        this.syncSetTargetNamespace = syncSetTargetNamespace;
        this.syncSetTargetName = syncSetTargetName;
    }

    /**
     * Loads the configuration from a map of environment variables
     *
     * @param map   Map with the environment variables
     *
     * @return  Operator configuration
     */
    public static TokenOperatorConfig buildFromMap(Map<String, String> map) {
        String splunkInstance = required(map, SPLUNK_INSTANCE);
        String splunkAuthToken = required(map, SPLUNK_AUTH_TOKEN);

        return new TokenOperatorConfig(
                splunkInstance,
                splunkAuthToken,
                parse(map, SPLUNK_ACS_URL, TokenOperatorConfig::parseUrl, SplunkAcsClient.DEFAULT_ACS_URL),
                parse(map, SPLUNK_COLLECTOR_DOMAIN, Function.identity(), DEFAULT_COLLECTOR_DOMAIN),
                parse(map, SPLUNK_TOKEN_MAX_AGE, TokenOperatorConfig::parseDuration, DEFAULT_TOKEN_MAX_AGE),
                new SplunkIndexes(
                        parse(map, SPLUNK_CLASSIC_DEFAULT_INDEX, Function.identity(), null),
                        parse(map, SPLUNK_CLASSIC_ALLOWED_INDEXES, TokenOperatorConfig::parseList, List.of())),
                new SplunkIndexes(
                        parse(map, SPLUNK_HCP_DEFAULT_INDEX, Function.identity(), null),
                        parse(map, SPLUNK_HCP_ALLOWED_INDEXES, TokenOperatorConfig::parseList, List.of())),
                parse(map, SPLUNK_TOKEN_OPERATOR_NAMESPACES, TokenOperatorConfig::parseNamespaces, Set.of(AbstractNamespacedResourceOperator.ANY_NAMESPACE)),
                parse(map, SPLUNK_TOKEN_OPERATOR_FULL_RECONCILIATION_INTERVAL_MS, TokenOperatorConfig::parsePositiveLong, DEFAULT_FULL_RECONCILIATION_INTERVAL_MS),
                parse(map, SPLUNK_TOKEN_OPERATOR_OPERATION_TIMEOUT_MS, TokenOperatorConfig::parsePositiveLong, DEFAULT_OPERATION_TIMEOUT_MS),
                parse(map, SPLUNK_TOKEN_OPERATOR_SYNCSET_ENABLED, TokenOperatorConfig::parseBoolean, true),
                parse(map, SPLUNK_TOKEN_OPERATOR_SYNCSET_TARGET_NAMESPACE, Function.identity(), DEFAULT_SYNCSET_TARGET_NAMESPACE),
                parse(map, SPLUNK_TOKEN_OPERATOR_SYNCSET_TARGET_NAME, Function.identity(), DEFAULT_SYNCSET_TARGET_NAME));
    }

    private static String required(Map<String, String> map, String key) {
        String value = map.get(key);
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(key + " has to be set");
        }
        return value.trim();
    }

    private static <T> T parse(Map<String, String> map, String key, Function<String, T> parser, T defaultValue) {
        String value = map.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidConfigurationException("Invalid value '" + value + "' of " + key + ": " + e.getMessage(), e);
        }
    }

    private static String parseUrl(String value) {
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            throw new IllegalArgumentException("URL must start with 'http://' or 'https://'");
        }
        return value;
    }

    private static Duration parseDuration(String value) {
        Duration duration = Duration.parse(value);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration has to be positive");
        }
        return duration;
    }

    private static long parsePositiveLong(String value) {
        long parsed = Long.parseLong(value);
        if (parsed <= 0) {
            throw new IllegalArgumentException("value has to be positive");
        }
        return parsed;
    }

    private static boolean parseBoolean(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException("expected true or false");
        }
    }

    /* test */ static List<String> parseList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private static Set<String> parseNamespaces(String value) {
        List<String> namespaces = parseList(value);
        if (namespaces.contains(AbstractNamespacedResourceOperator.ANY_NAMESPACE)) {
            if (namespaces.size() > 1) {
                throw new IllegalArgumentException("'" + AbstractNamespacedResourceOperator.ANY_NAMESPACE + "' cannot be combined with other namespaces");
            }
            return Set.of(AbstractNamespacedResourceOperator.ANY_NAMESPACE);
        }
        return Set.copyOf(namespaces);
    }

    /**
     * @return  Name of the Splunk Cloud stack
     */
    public String getSplunkInstance() {
        return splunkInstance;
    }

    /**
     * @return  ACS authentication token
     */
    public String getSplunkAuthToken() {
        return splunkAuthToken;
    }

    /**
     * @return  Base URL of the Admin Config Service
     */
    public String getAcsUrl() {
        return acsUrl;
    }

    /**
     * @return  Domain of the HEC endpoint
     */
    public String getCollectorDomain() {
        return collectorDomain;
    }

    /**
     * @return  Age after which the HEC tokens are rotated
     */
    public Duration getTokenMaxAge() {
        return tokenMaxAge;
    }

    /**
     * @return  Indexes of the classic clusters
     */
    public SplunkIndexes getClassicIndexes() {
        return classicIndexes;
    }

    /**
     * @return  Indexes of the management clusters of hosted control planes
     */
    public SplunkIndexes getHcpIndexes() {
        return hcpIndexes;
    }

    /**
     * @return  Watched namespaces
     */
    public Set<String> getNamespaces() {
        return namespaces;
    }

    /**
     * @return  Interval of the periodic reconciliation in milliseconds
     */
    public long getFullReconciliationIntervalMs() {
        return fullReconciliationIntervalMs;
    }

    /**
     * @return  Connect and idle timeout of the requests to Splunk in milliseconds
     */
    public long getOperationTimeoutMs() {
        return operationTimeoutMs;
    }

    /**
     * @return  True when the SyncSets copying the Secret into the managed clusters should be created
     */
    public boolean isSyncSetEnabled() {
        return syncSetEnabled;
    }

    public String getSyncSetTargetNamespace() {
        return syncSetTargetNamespace;
    }

    public String getSyncSetTargetName() {
        return syncSetTargetName;
    }

    @Override
    public String toString() {
        return "TokenOperatorConfig(" +
                "splunkInstance=" + splunkInstance +
                ",splunkAuthToken=<hidden>" +
                ",acsUrl=" + acsUrl +
                ",collectorDomain=" + collectorDomain +
                ",tokenMaxAge=" + tokenMaxAge +
                ",classicIndexes=" + classicIndexes +
                ",hcpIndexes=" + hcpIndexes +
                ",namespaces=" + namespaces +
                ",fullReconciliationIntervalMs=" + fullReconciliationIntervalMs +
                ",operationTimeoutMs=" + operationTimeoutMs +
                ",syncSetEnabled=" + syncSetEnabled +
                ",syncSetTargetNamespace=" + syncSetTargetNamespace +
                ",syncSetTargetName=" + syncSetTargetName +
                ")";
    }
}
