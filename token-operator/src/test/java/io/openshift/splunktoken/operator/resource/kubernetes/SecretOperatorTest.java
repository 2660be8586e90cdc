/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.openshift.splunktoken.operator.common.Reconciliation;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

@ExtendWith(VertxExtension.class)
@EnableKubernetesMockClient(crud = true)
public class SecretOperatorTest {
    private static final String NAMESPACE = "uhc-production-1234";
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", "Secret", NAMESPACE, "splunk-hec-token");

    private static Vertx vertx;

    KubernetesClient client;
    private SecretOperator operator;

    @BeforeAll
    public static void before() {
        vertx = Vertx.vertx();
    }

    @AfterAll
    public static void after() {
        vertx.close();
    }

    @BeforeEach
    public void setUp() {
        operator = new SecretOperator(vertx, client);
    }

    private static Secret secret(String namespace, String name, Map<String, String> labels) {
        return new SecretBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels)
                .endMetadata()
                .withData(Map.of("outputs.conf", "dmFsdWU="))
                .build();
    }

    @Test
    public void testGetMissingSecret(VertxTestContext context) {
        operator.getAsync(NAMESPACE, "splunk-hec-token")
                .onComplete(context.succeeding(secret -> context.verify(() -> {
                    assertThat(secret, is(nullValue()));
                    context.completeNow();
                })));
    }

    @Test
    public void testCreateAndGet(VertxTestContext context) {
        operator.createAsync(RECONCILIATION, secret(NAMESPACE, "splunk-hec-token", Map.of()))
                .compose(created -> operator.getAsync(NAMESPACE, "splunk-hec-token"))
                .onComplete(context.succeeding(secret -> context.verify(() -> {
                    assertThat(secret, is(notNullValue()));
                    assertThat(secret.getData().get("outputs.conf"), is("dmFsdWU="));
                    context.completeNow();
                })));
    }

    @Test
    public void testDelete(VertxTestContext context) {
        client.secrets().inNamespace(NAMESPACE).resource(secret(NAMESPACE, "splunk-hec-token", Map.of())).create();

        operator.deleteAsync(RECONCILIATION, NAMESPACE, "splunk-hec-token")
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    assertThat(operator.get(NAMESPACE, "splunk-hec-token"), is(nullValue()));
                    context.completeNow();
                })));
    }

    @Test
    public void testDeleteMissingSecret(VertxTestContext context) {
        operator.deleteAsync(RECONCILIATION, NAMESPACE, "splunk-hec-token")
                .onComplete(context.succeedingThenComplete());
    }

    @Test
    public void testListWithLabels(VertxTestContext context) {
        client.secrets().inNamespace(NAMESPACE).resource(secret(NAMESPACE, "managed", Map.of("app.kubernetes.io/managed-by", "splunk-token-operator"))).create();
        client.secrets().inNamespace("other").resource(secret("other", "managed", Map.of("app.kubernetes.io/managed-by", "splunk-token-operator"))).create();
        client.secrets().inNamespace(NAMESPACE).resource(secret(NAMESPACE, "unmanaged", Map.of())).create();

        operator.listAsync(AbstractNamespacedResourceOperator.ANY_NAMESPACE, Map.of("app.kubernetes.io/managed-by", "splunk-token-operator"))
                .compose(all -> {
                    context.verify(() -> assertThat(all, hasSize(2)));
                    return operator.listAsync(NAMESPACE, null);
                })
                .onComplete(context.succeeding(inNamespace -> context.verify(() -> {
                    assertThat(inNamespace, hasSize(2));
                    context.completeNow();
                })));
    }
}
