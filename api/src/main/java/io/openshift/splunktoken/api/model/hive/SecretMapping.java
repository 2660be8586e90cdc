/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.hive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.SecretReference;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;

/**
 * Maps a Secret in the Hive cluster to a Secret in the managed cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"sourceRef", "targetRef"})
@EqualsAndHashCode
@ToString
public class SecretMapping implements Serializable {
    private static final long serialVersionUID = 1L;

    private SecretReference sourceRef;
    private SecretReference targetRef;

    public SecretMapping() {
    }

    public SecretMapping(SecretReference sourceRef, SecretReference targetRef) {
        this.sourceRef = sourceRef;
        this.targetRef = targetRef;
    }

    public SecretReference getSourceRef() {
        return sourceRef;
    }

    public void setSourceRef(SecretReference sourceRef) {
        this.sourceRef = sourceRef;
    }

    public SecretReference getTargetRef() {
        return targetRef;
    }

    public void setTargetRef(SecretReference targetRef) {
        this.targetRef = targetRef;
    }
}
