/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.model;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.openshift.splunktoken.api.model.common.Constants;
import io.openshift.splunktoken.api.model.splunktoken.SplunkToken;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Builds the Secret with the Splunk forwarder configuration containing the HEC token. The Secret is immutable, a new
 * token always comes with a new Secret.
 */
public class HecTokenSecret {
    /**
     * Name of the Secret in the namespace of the SplunkToken
     */
    public static final String SECRET_NAME = "splunk-hec-token";

    /**
     * Key of the forwarder configuration in the Secret data
     */
    public static final String OUTPUTS_CONF_KEY = "outputs.conf";

    /**
     * Label marking the resources created by the operator
     */
    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";

    private static final String OUTPUTS_CONF_TEMPLATE = "[httpout]\nhttpEventCollectorToken = %s\nuri = %s";

    private final String collectorUri;

    /**
     * Constructor
     *
     * @param splunkInstance    Name of the Splunk Cloud stack
     * @param collectorDomain   Domain of the HEC endpoint
     */
    public HecTokenSecret(String splunkInstance, String collectorDomain) {
        this.collectorUri = "https://http-inputs-" + splunkInstance + "." + collectorDomain + ":443";
    }

    /**
     * @return  URI of the HEC endpoint the forwarders send the events to
     */
    public String collectorUri() {
        return collectorUri;
    }

    /**
     * Renders the forwarder configuration. The output has no trailing newline.
     *
     * @param tokenValue    Value of the HEC token
     *
     * @return  Content of outputs.conf
     */
    public String outputsConf(String tokenValue) {
        return String.format(OUTPUTS_CONF_TEMPLATE, tokenValue, collectorUri);
    }

    /**
     * Builds the Secret owned and controlled by the SplunkToken
     *
     * @param owner         SplunkToken owning the Secret
     * @param tokenValue    Value of the HEC token
     *
     * @return  The Secret
     */
    public Secret build(SplunkToken owner, String tokenValue) {
        String encoded = Base64.getEncoder().encodeToString(outputsConf(tokenValue).getBytes(StandardCharsets.UTF_8));

        return new SecretBuilder()
                .withNewMetadata()
                    .withName(SECRET_NAME)
                    .withNamespace(owner.getMetadata().getNamespace())
                    .withLabels(Map.of(MANAGED_BY_LABEL, Constants.OPERATOR_NAME))
                    .withOwnerReferences(OwnerReferences.controllerReference(owner))
                .endMetadata()
                .withType("Opaque")
                .withImmutable(true)
                .withData(Map.of(OUTPUTS_CONF_KEY, encoded))
                .build();
    }
}
