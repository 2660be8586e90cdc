/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.model;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared methods for working with owner references. The operator relies on them for the ownership chain
 * ClusterDeployment, SplunkToken and Secret: the Kubernetes garbage collector deletes the owned resources when their
 * owner is deleted and the SplunkToken finalizer holds the chain until the HEC token is removed from Splunk.
 */
public class OwnerReferences {
    private OwnerReferences() {
    }

    /**
     * Creates a controller reference. The owned resource is deleted together with its owner and the owner cannot be
     * deleted in the foreground before the owned resource is gone.
     *
     * @param owner     Owning resource
     *
     * @return  Controller owner reference
     */
    public static OwnerReference controllerReference(HasMetadata owner) {
        return new OwnerReferenceBuilder()
                .withApiVersion(owner.getApiVersion())
                .withKind(owner.getKind())
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    /**
     * Creates a plain owner reference which is not a controller reference
     *
     * @param owner     Owning resource
     *
     * @return  Owner reference
     */
    public static OwnerReference ownerReference(HasMetadata owner) {
        return new OwnerReferenceBuilder()
                .withApiVersion(owner.getApiVersion())
                .withKind(owner.getKind())
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .build();
    }

    /**
     * Adds the owner reference to the resource. An existing reference to the same owner is replaced, other owner
     * references are kept.
     *
     * @param resource  Resource which should be updated
     * @param reference Owner reference to add
     */
    public static void setOwnerReference(HasMetadata resource, OwnerReference reference) {
        List<OwnerReference> existing = resource.getMetadata().getOwnerReferences();
        List<OwnerReference> updated = new ArrayList<>();

        if (existing != null) {
            for (OwnerReference ref : existing) {
                if (!sameOwner(ref, reference)) {
                    updated.add(ref);
                }
            }
        }

        updated.add(reference);
        resource.getMetadata().setOwnerReferences(updated);
    }

    /**
     * Finds the name of the owner of given kind
     *
     * @param resource  Owned resource
     * @param kind      Kind of the owner
     *
     * @return  Name of the owner or null if the resource has no owner of this kind
     */
    public static String ownerName(HasMetadata resource, String kind) {
        List<OwnerReference> references = resource.getMetadata().getOwnerReferences();
        if (references != null) {
            for (OwnerReference ref : references) {
                if (kind.equals(ref.getKind())) {
                    return ref.getName();
                }
            }
        }

        return null;
    }

    private static boolean sameOwner(OwnerReference a, OwnerReference b) {
        return apiGroup(a.getApiVersion()).equals(apiGroup(b.getApiVersion()))
                && a.getKind().equals(b.getKind())
                && a.getName().equals(b.getName());
    }

    private static String apiGroup(String apiVersion) {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }
}
