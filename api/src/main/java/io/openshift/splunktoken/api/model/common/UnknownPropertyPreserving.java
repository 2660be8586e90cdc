/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.common;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.Map;

/**
 * Implemented by model classes which are only partially mapped. Properties which are not known to the model are kept
 * in a map so that they survive a read-modify-write cycle against the Kubernetes API.
 */
public interface UnknownPropertyPreserving {
    /**
     * @return  Map with the properties which are not mapped by the model class
     */
    @JsonAnyGetter
    Map<String, Object> getAdditionalProperties();

    /**
     * Stores a property which is not mapped by the model class
     *
     * @param name      Name of the property
     * @param value     Value of the property
     */
    @JsonAnySetter
    void setAdditionalProperty(String name, Object value);
}
