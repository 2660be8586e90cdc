/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.assembly;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.openshift.splunktoken.api.model.splunktoken.SplunkToken;
import io.openshift.splunktoken.api.model.splunktoken.SplunkTokenSpec;
import io.openshift.splunktoken.operator.TokenOperatorConfig;
import io.openshift.splunktoken.operator.common.InvalidResourceException;
import io.openshift.splunktoken.operator.common.Reconciliation;
import io.openshift.splunktoken.operator.model.HecTokenSecret;
import io.openshift.splunktoken.operator.resource.ResourceOperatorSupplier;
import io.openshift.splunktoken.operator.resource.kubernetes.ClusterDeploymentOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SecretOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SplunkTokenOperator;
import io.openshift.splunktoken.operator.resource.kubernetes.SyncSetOperator;
import io.openshift.splunktoken.operator.splunk.HecToken;
import io.openshift.splunktoken.operator.splunk.SplunkApiException;
import io.openshift.splunktoken.operator.splunk.SplunkTokenManager;
import io.vertx.core.Future;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(VertxExtension.class)
public class SplunkTokenReconcilerTest {
    private static final String NAMESPACE = "uhc-production-1234";
    private static final String CLUSTER_ID = "1234";
    private static final String SPLUNK_INSTANCE = "<splunk-collector-uri>";
    private static final String TOKEN_VALUE = "<guid-value>";
    private static final String EXPECTED_OUTPUTS_CONF = "W2h0dHBvdXRdCmh0dHBFdmVudENvbGxlY3RvclRva2VuID0gPGd1aWQtdmFsdWU+CnVyaSA9IGh0dHBzOi8vaHR0cC1pbnB1dHMtPHNwbHVuay1jb2xsZWN0b3ItdXJpPi5zcGx1bmtjbG91ZC5jb206NDQz";

    private static final Instant NOW = Instant.parse("2025-01-31T00:00:00Z");
    private static final String FRESH = "2025-01-20T00:00:00Z";
    private static final String STALE = "2024-12-01T00:00:00Z";

    private static final TokenOperatorConfig CONFIG = TokenOperatorConfig.buildFromMap(Map.of(
            TokenOperatorConfig.SPLUNK_INSTANCE, SPLUNK_INSTANCE,
            TokenOperatorConfig.SPLUNK_AUTH_TOKEN, "jwt",
            TokenOperatorConfig.SPLUNK_TOKEN_MAX_AGE, "P30D"));

    private final Reconciliation reconciliation = new Reconciliation("test", SplunkToken.RESOURCE_KIND, NAMESPACE, SplunkToken.TOKEN_NAME);

    private SplunkTokenOperator tokenOperator;
    private SecretOperator secretOperator;
    private SplunkTokenManager splunk;
    private SplunkTokenReconciler reconciler;

    @BeforeEach
    public void setUp() {
        tokenOperator = mock(SplunkTokenOperator.class);
        secretOperator = mock(SecretOperator.class);
        splunk = mock(SplunkTokenManager.class);

        when(tokenOperator.updateAsync(any(), any())).thenAnswer(i -> Future.succeededFuture(i.getArgument(1)));
        when(tokenOperator.deleteAsync(any(), anyString(), anyString())).thenReturn(Future.succeededFuture());
        when(secretOperator.createAsync(any(), any())).thenAnswer(i -> Future.succeededFuture(i.getArgument(1)));

        ResourceOperatorSupplier supplier = new ResourceOperatorSupplier(secretOperator, tokenOperator,
                mock(ClusterDeploymentOperator.class), mock(SyncSetOperator.class));
        reconciler = new SplunkTokenReconciler(CONFIG, supplier, splunk, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SplunkToken token(String creationTimestamp, List<String> finalizers) {
        SplunkToken token = new SplunkToken();
        token.setMetadata(new ObjectMetaBuilder()
                .withName(SplunkToken.TOKEN_NAME)
                .withNamespace(NAMESPACE)
                .withUid("token-uid")
                .withCreationTimestamp(creationTimestamp)
                .withFinalizers(finalizers)
                .build());
        token.setSpec(new SplunkTokenSpec(CLUSTER_ID, "classic_index", List.of("classic_index")));
        return token;
    }

    private void mockToken(SplunkToken token) {
        when(tokenOperator.getAsync(NAMESPACE, SplunkToken.TOKEN_NAME)).thenReturn(Future.succeededFuture(token));
    }

    private void mockSecret(Secret secret) {
        when(secretOperator.getAsync(NAMESPACE, HecTokenSecret.SECRET_NAME)).thenReturn(Future.succeededFuture(secret));
    }

    @Test
    public void testMissingTokenIsIgnored(VertxTestContext context) {
        mockToken(null);

        reconciler.reconcile(reconciliation)
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    verifyNoInteractions(splunk);
                    verifyNoInteractions(secretOperator);
                    verify(tokenOperator, never()).updateAsync(any(), any());
                    context.completeNow();
                })));
    }

    @Test
    public void testDeletedTokenIsRemovedFromSplunk(VertxTestContext context) {
        SplunkToken token = token(FRESH, List.of(SplunkToken.FINALIZER));
        token.getMetadata().setDeletionTimestamp("2025-01-30T00:00:00Z");
        mockToken(token);
        when(splunk.deleteToken(CLUSTER_ID)).thenReturn(Future.succeededFuture());

        reconciler.reconcile(reconciliation)
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    verify(splunk).deleteToken(CLUSTER_ID);
                    verify(splunk, never()).createToken(any());

                    ArgumentCaptor<SplunkToken> updated = ArgumentCaptor.forClass(SplunkToken.class);
                    verify(tokenOperator).updateAsync(eq(reconciliation), updated.capture());
                    assertThat(updated.getValue().getMetadata().getFinalizers(), is(empty()));

                    verifyNoInteractions(secretOperator);
                    context.completeNow();
                })));
    }

    @Test
    public void testFinalizerIsKeptWhenSplunkDeletionFails(VertxTestContext context) {
        SplunkToken token = token(FRESH, List.of(SplunkToken.FINALIZER));
        token.getMetadata().setDeletionTimestamp("2025-01-30T00:00:00Z");
        mockToken(token);
        when(splunk.deleteToken(CLUSTER_ID)).thenReturn(Future.failedFuture(new SplunkApiException(500, "500-internal-server-error", "boom")));

        reconciler.reconcile(reconciliation)
                .onComplete(context.failing(e -> context.verify(() -> {
                    assertThat(e, instanceOf(SplunkApiException.class));
                    verify(tokenOperator, never()).updateAsync(any(), any());
                    context.completeNow();
                })));
    }

    @Test
    public void testStaleTokenIsDeletedWithoutCallingSplunk(VertxTestContext context) {
        mockToken(token(STALE, List.of(SplunkToken.FINALIZER)));

        reconciler.reconcile(reconciliation)
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    verify(tokenOperator).deleteAsync(reconciliation, NAMESPACE, SplunkToken.TOKEN_NAME);
                    verifyNoInteractions(splunk);
                    verifyNoInteractions(secretOperator);
                    context.completeNow();
                })));
    }

    @Test
    public void testTokenWithExistingSecretIsNotChanged(VertxTestContext context) {
        mockToken(token(FRESH, List.of(SplunkToken.FINALIZER)));
        mockSecret(new SecretBuilder().withNewMetadata().withName(HecTokenSecret.SECRET_NAME).withNamespace(NAMESPACE).endMetadata().build());

        reconciler.reconcile(reconciliation)
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    verifyNoInteractions(splunk);
                    verify(secretOperator, never()).createAsync(any(), any());
                    verify(tokenOperator, never()).updateAsync(any(), any());
                    verify(tokenOperator, never()).deleteAsync(any(), anyString(), anyString());
                    context.completeNow();
                })));
    }

    @Test
    public void testNewTokenIsCreatedWithSecret(VertxTestContext context) {
        mockToken(token(FRESH, List.of()));
        mockSecret(null);
        when(splunk.createToken(any())).thenReturn(Future.succeededFuture(
                new HecToken(new SplunkTokenSpec(CLUSTER_ID, "classic_index", List.of("classic_index")), TOKEN_VALUE)));

        reconciler.reconcile(reconciliation)
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    ArgumentCaptor<SplunkToken> updated = ArgumentCaptor.forClass(SplunkToken.class);
                    verify(tokenOperator).updateAsync(eq(reconciliation), updated.capture());
                    assertThat(updated.getValue().getMetadata().getFinalizers(), contains(SplunkToken.FINALIZER));

                    ArgumentCaptor<HecToken> requested = ArgumentCaptor.forClass(HecToken.class);
                    verify(splunk).createToken(requested.capture());
                    assertThat(requested.getValue().getName(), is(CLUSTER_ID));
                    assertThat(requested.getValue().getDefaultIndex(), is("classic_index"));

                    ArgumentCaptor<Secret> created = ArgumentCaptor.forClass(Secret.class);
                    verify(secretOperator).createAsync(eq(reconciliation), created.capture());
                    Secret secret = created.getValue();
                    assertThat(secret.getMetadata().getName(), is(HecTokenSecret.SECRET_NAME));
                    assertThat(secret.getMetadata().getNamespace(), is(NAMESPACE));
                    assertThat(secret.getImmutable(), is(true));
                    assertThat(secret.getData().get(HecTokenSecret.OUTPUTS_CONF_KEY), is(EXPECTED_OUTPUTS_CONF));

                    assertThat(secret.getMetadata().getOwnerReferences(), hasSize(1));
                    OwnerReference owner = secret.getMetadata().getOwnerReferences().get(0);
                    assertThat(owner.getKind(), is(SplunkToken.RESOURCE_KIND));
                    assertThat(owner.getName(), is(SplunkToken.TOKEN_NAME));
                    assertThat(owner.getUid(), is("token-uid"));
                    assertThat(owner.getController(), is(true));
                    assertThat(owner.getBlockOwnerDeletion(), is(true));

                    context.completeNow();
                })));
    }

    @Test
    public void testExistingFinalizerIsNotUpdated(VertxTestContext context) {
        mockToken(token(FRESH, List.of(SplunkToken.FINALIZER)));
        mockSecret(null);
        when(splunk.createToken(any())).thenReturn(Future.succeededFuture(new HecToken(new SplunkTokenSpec(CLUSTER_ID, null, null), TOKEN_VALUE)));

        reconciler.reconcile(reconciliation)
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    verify(tokenOperator, never()).updateAsync(any(), any());
                    verify(secretOperator).createAsync(eq(reconciliation), any());
                    context.completeNow();
                })));
    }

    @Test
    public void testSplunkFailureDoesNotCreateSecret(VertxTestContext context) {
        mockToken(token(FRESH, List.of()));
        mockSecret(null);
        when(splunk.createToken(any())).thenReturn(Future.failedFuture(new SplunkApiException(400, "400-oh-no-it-broke", "halt and catch fire")));

        reconciler.reconcile(reconciliation)
                .onComplete(context.failing(e -> context.verify(() -> {
                    assertThat(e.getMessage(), is("received error response 400-oh-no-it-broke: halt and catch fire"));
                    verify(secretOperator, never()).createAsync(any(), any());
                    context.completeNow();
                })));
    }

    @Test
    public void testTokenWithoutNameIsRejected(VertxTestContext context) {
        SplunkToken token = token(FRESH, List.of());
        token.setSpec(new SplunkTokenSpec());
        mockToken(token);
        mockSecret(null);

        reconciler.reconcile(reconciliation)
                .onComplete(context.failing(e -> context.verify(() -> {
                    assertThat(e, instanceOf(InvalidResourceException.class));
                    verifyNoInteractions(splunk);
                    context.completeNow();
                })));
    }

    @Test
    public void testTokenIsStaleOnlyAfterMaxAge() {
        assertThat(reconciler.isStale(token("2025-01-01T00:00:00Z", List.of())), is(false));
        assertThat(reconciler.isStale(token("2024-12-31T23:59:59Z", List.of())), is(true));
        assertThat(reconciler.isStale(token(null, List.of())), is(false));
    }
}
