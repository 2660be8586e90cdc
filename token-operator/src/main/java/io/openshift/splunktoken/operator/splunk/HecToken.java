/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.splunk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.openshift.splunktoken.api.model.splunktoken.SplunkTokenSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A Splunk HEC token: its spec (name and indexes) and its value, which is the secret used by the log forwarders
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HecToken {
    private final SplunkTokenSpec spec;
    private final String value;

    /**
     * Creates a token without a value, as used for creating new tokens
     *
     * @param spec  Spec of the token
     */
    public HecToken(SplunkTokenSpec spec) {
        this(spec, null);
    }

    /**
     * Constructor
     *
     * @param spec  Spec of the token
     * @param value Value of the token
     */
    @JsonCreator
    public HecToken(@JsonProperty("spec") SplunkTokenSpec spec, @JsonProperty("token") String value) {
        this.spec = spec != null ? spec : new SplunkTokenSpec();
        this.value = value;
    }

    @JsonProperty("spec")
    public SplunkTokenSpec getSpec() {
        return spec;
    }

    @JsonProperty("token")
    public String getValue() {
        return value;
    }

    @JsonIgnore
    public String getName() {
        return spec.getName();
    }

    @JsonIgnore
    public String getDefaultIndex() {
        return spec.getDefaultIndex();
    }

    @JsonIgnore
    public List<String> getAllowedIndexes() {
        return spec.getAllowedIndexes();
    }

    /**
     * Splunk requires the default index of a token to be one of its allowed indexes. Returns a copy of this token
     * with the default index appended to the allowed indexes when it is not there yet. The order of the allowed
     * indexes is kept and this token is not modified.
     *
     * @return  Token with the default index included in the allowed indexes
     */
    public HecToken withDefaultIndexAllowed() {
        String defaultIndex = spec.getDefaultIndex();
        List<String> allowedIndexes = spec.getAllowedIndexes() != null ? new ArrayList<>(spec.getAllowedIndexes()) : null;

        if (defaultIndex != null && !defaultIndex.isEmpty()
                && (allowedIndexes == null || !allowedIndexes.contains(defaultIndex))) {
            if (allowedIndexes == null) {
                allowedIndexes = new ArrayList<>(1);
            }
            allowedIndexes.add(defaultIndex);
        }

        return new HecToken(new SplunkTokenSpec(spec.getName(), defaultIndex, allowedIndexes), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        }
        HecToken hecToken = (HecToken) o;
        return Objects.equals(spec, hecToken.spec) && Objects.equals(value, hecToken.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spec, value);
    }

    @Override
    public String toString() {
        // The value is a credential
        return "HecToken(spec=" + spec + ", value=" + (value != null ? "<hidden>" : "null") + ")";
    }
}
