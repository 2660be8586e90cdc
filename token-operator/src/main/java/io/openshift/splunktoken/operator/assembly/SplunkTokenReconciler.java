/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.assembly;

import io.fabric8.kubernetes.api.model.Secret;
import io.openshift.splunktoken.api.model.splunktoken.SplunkToken;
import io.openshift.splunktoken.api.model.splunktoken.SplunkTokenSpec;
import io.openshift.splunktoken.operator.TokenOperatorConfig;
import io.openshift.splunktoken.operator.common.InvalidResourceException;
import io.openshift.splunktoken.operator.common.Reconciliation;
import io.openshift.splunktoken.operator.common.ReconciliationLogger;
import io.openshift.splunktoken.operator.model.HecTokenSecret;
import io.openshift.splunktoken.operator.resource.ResourceOperatorSupplier;
import io.openshift.splunktoken.operator.resource.kubernetes.SecretOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SplunkTokenOperator;
import io.openshift.splunktoken.operator.splunk.HecToken;
import io.openshift.splunktoken.operator.splunk.SplunkResponseDecodeException;
import io.openshift.splunktoken.operator.splunk.SplunkTokenManager;
import io.vertx.core.Future;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reconciles SplunkTokens with the HEC tokens in Splunk. A single pass does at most one of these things:
 * <ul>
 *     <li>removes the HEC token from Splunk and releases the finalizer of a SplunkToken which is being deleted</li>
 *     <li>deletes a SplunkToken older than the maximum token age so that a new one is created</li>
 *     <li>creates the HEC token in Splunk together with the Secret holding it when the Secret does not exist</li>
 * </ul>
 */
public class SplunkTokenReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(SplunkTokenReconciler.class);

    private final SplunkTokenOperator tokenOperator;
    private final SecretOperator secretOperator;
    private final SplunkTokenManager splunk;
    private final HecTokenSecret secretModel;
    private final Duration tokenMaxAge;
    private final Clock clock;

    /**
     * Constructor
     *
     * @param config        Operator configuration
     * @param supplier      Supplier of the resource operators
     * @param splunk        Client for managing the HEC tokens in Splunk
     */
    public SplunkTokenReconciler(TokenOperatorConfig config, ResourceOperatorSupplier supplier, SplunkTokenManager splunk) {
        this(config, supplier, splunk, Clock.systemUTC());
    }

    /**
     * Constructor
     *
     * @param config        Operator configuration
     * @param supplier      Supplier of the resource operators
     * @param splunk        Client for managing the HEC tokens in Splunk
     * @param clock         Clock used to decide whether a token should be rotated
     */
    public SplunkTokenReconciler(TokenOperatorConfig config, ResourceOperatorSupplier supplier, SplunkTokenManager splunk, Clock clock) {
        this.tokenOperator = supplier.splunkTokenOperator;
        this.secretOperator = supplier.secretOperations;
        this.splunk = splunk;
        this.secretModel = new HecTokenSecret(config.getSplunkInstance(), config.getCollectorDomain());
        this.tokenMaxAge = config.getTokenMaxAge();
        this.clock = clock;
    }

    /**
     * Reconciles the SplunkToken identified by the reconciliation
     *
     * @param reconciliation    Reconciliation with the namespace and name of the SplunkToken
     *
     * @return  Future which completes when the reconciliation is done
     */
    public Future<Void> reconcile(Reconciliation reconciliation) {
        return tokenOperator.getAsync(reconciliation.namespace(), reconciliation.name())
                .compose(token -> {
                    if (token == null) {
                        LOGGER.infoCr(reconciliation, "SplunkToken not found");
                        return Future.succeededFuture();
                    } else if (token.getMetadata().getDeletionTimestamp() != null) {
                        return revoke(reconciliation, token);
                    } else if (isStale(token)) {
                        LOGGER.infoCr(reconciliation, "SplunkToken is older than {}, rotating", tokenMaxAge);
                        return tokenOperator.deleteAsync(reconciliation, reconciliation.namespace(), reconciliation.name());
                    } else {
                        return secretOperator.getAsync(reconciliation.namespace(), HecTokenSecret.SECRET_NAME)
                                .compose(secret -> {
                                    if (secret != null) {
                                        LOGGER.debugCr(reconciliation, "Secret {} exists, nothing to do", HecTokenSecret.SECRET_NAME);
                                        return Future.succeededFuture();
                                    }

                                    LOGGER.infoCr(reconciliation, "Secret {} not found, requesting a new HEC token from Splunk", HecTokenSecret.SECRET_NAME);
                                    return provision(reconciliation, token);
                                });
                    }
                });
    }

    /**
     * Deletes the HEC token from Splunk and removes the finalizer so that the SplunkToken deletion can complete
     */
    private Future<Void> revoke(Reconciliation reconciliation, SplunkToken token) {
        String tokenName = token.getSpec() != null ? token.getSpec().getName() : null;

        Future<Void> remoteDeletion;
        if (tokenName == null || tokenName.isEmpty()) {
            LOGGER.warnCr(reconciliation, "SplunkToken has no HEC token name, skipping the deletion from Splunk");
            remoteDeletion = Future.succeededFuture();
        } else {
            LOGGER.infoCr(reconciliation, "SplunkToken is being deleted, deleting HEC token {} from Splunk", tokenName);
            remoteDeletion = splunk.deleteToken(tokenName);
        }

        return remoteDeletion
                .compose(i -> {
                    if (token.removeFinalizer(SplunkToken.FINALIZER)) {
                        return tokenOperator.updateAsync(reconciliation, token)
                                .map(updated -> {
                                    LOGGER.infoCr(reconciliation, "Finalizer removed from SplunkToken");
                                    return null;
                                });
                    } else {
                        return Future.succeededFuture();
                    }
                });
    }

    private Future<Void> provision(Reconciliation reconciliation, SplunkToken token) {
        SplunkTokenSpec spec = token.getSpec();
        if (spec == null || spec.getName() == null || spec.getName().isEmpty()) {
            return Future.failedFuture(new InvalidResourceException("SplunkToken " + reconciliation.namespace() + "/" + reconciliation.name() + " has no HEC token name"));
        }

        return addFinalizer(reconciliation, token)
                .compose(owner -> splunk.createToken(new HecToken(spec))
                        .compose(hecToken -> {
                            if (hecToken.getValue() == null || hecToken.getValue().isEmpty()) {
                                return Future.failedFuture(new SplunkResponseDecodeException("HEC token " + spec.getName() + " was returned without a value"));
                            }

                            Secret secret = secretModel.build(owner, hecToken.getValue());
                            return secretOperator.createAsync(reconciliation, secret);
                        })
                        .map(secret -> {
                            LOGGER.infoCr(reconciliation, "Secret {} with HEC token {} created", HecTokenSecret.SECRET_NAME, spec.getName());
                            return null;
                        }));
    }

    /**
     * The finalizer is added before the HEC token is created so that the token cannot leak in Splunk when the
     * SplunkToken is deleted in the meantime. The SplunkToken is updated only when the finalizer was missing.
     */
    private Future<SplunkToken> addFinalizer(Reconciliation reconciliation, SplunkToken token) {
        if (token.addFinalizer(SplunkToken.FINALIZER)) {
            return tokenOperator.updateAsync(reconciliation, token)
                    .map(updated -> {
                        LOGGER.infoCr(reconciliation, "Finalizer added to SplunkToken");
                        return updated != null ? updated : token;
                    });
        } else {
            return Future.succeededFuture(token);
        }
    }

    /* test */ boolean isStale(SplunkToken token) {
        String creationTimestamp = token.getMetadata().getCreationTimestamp();
        if (creationTimestamp == null) {
            return false;
        }

        Instant rotationDeadline = Instant.parse(creationTimestamp).plus(tokenMaxAge);
        return clock.instant().isAfter(rotationDeadline);
    }
}
