/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.splunktoken;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.KubernetesResource;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Spec of a Splunk HEC token. The same structure is sent as the payload when the token is created through the
 * Splunk Admin Config Service, so empty fields are omitted from the JSON. Splunk returns more fields in the token
 * spec than the operator manages, these are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonDeserialize(using = JsonDeserializer.None.class)
@JsonPropertyOrder({"name", "defaultIndex", "allowedIndexes"})
@EqualsAndHashCode
@ToString
public class SplunkTokenSpec implements KubernetesResource {
    private static final long serialVersionUID = 1L;

    private String name;
    private String defaultIndex;
    private List<String> allowedIndexes;

    /**
     * Constructs an empty spec
     */
    public SplunkTokenSpec() {
    }

    /**
     * Constructs the spec
     *
     * @param name              Name of the HEC token in Splunk
     * @param defaultIndex      Index used when the event does not specify one
     * @param allowedIndexes    Indexes the token is allowed to write to
     */
    public SplunkTokenSpec(String name, String defaultIndex, List<String> allowedIndexes) {
        this.name = name;
        this.defaultIndex = defaultIndex;
        this.allowedIndexes = allowedIndexes != null ? new ArrayList<>(allowedIndexes) : null;
    }

    /**
     * Name of the HEC token in Splunk. It is the ID of the cluster the token belongs to.
     *
     * @return  Token name
     */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return  Index used by Splunk when the event does not specify one
     */
    public String getDefaultIndex() {
        return defaultIndex;
    }

    public void setDefaultIndex(String defaultIndex) {
        this.defaultIndex = defaultIndex;
    }

    /**
     * @return  Ordered list of the indexes the token can write to
     */
    public List<String> getAllowedIndexes() {
        return allowedIndexes;
    }

    public void setAllowedIndexes(List<String> allowedIndexes) {
        this.allowedIndexes = allowedIndexes;
    }
}
