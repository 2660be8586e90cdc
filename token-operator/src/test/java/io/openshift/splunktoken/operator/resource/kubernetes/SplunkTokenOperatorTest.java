/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.openshift.splunktoken.api.model.splunktoken.SplunkToken;
import io.openshift.splunktoken.api.model.splunktoken.SplunkTokenSpec;
import io.openshift.splunktoken.operator.common.Reconciliation;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

@ExtendWith(VertxExtension.class)
@EnableKubernetesMockClient(crud = true)
public class SplunkTokenOperatorTest {
    private static final String NAMESPACE = "uhc-production-1234";
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", SplunkToken.RESOURCE_KIND, NAMESPACE, SplunkToken.TOKEN_NAME);

    private static Vertx vertx;

    KubernetesClient client;
    private SplunkTokenOperator operator;

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
        operator = new SplunkTokenOperator(vertx, client);
    }

    private static SplunkToken token() {
        SplunkToken token = new SplunkToken();
        token.setMetadata(new ObjectMetaBuilder()
                .withName(SplunkToken.TOKEN_NAME)
                .withNamespace(NAMESPACE)
                .build());
        token.setSpec(new SplunkTokenSpec("1234", "classic_index", List.of("classic_index")));
        return token;
    }

    @Test
    public void testCreateUpdateAndGet(VertxTestContext context) {
        operator.createAsync(RECONCILIATION, token())
                .compose(created -> {
                    created.setSpec(new SplunkTokenSpec("1234", "new_index", List.of("new_index", "classic_index")));
                    created.addFinalizer(SplunkToken.FINALIZER);
                    return operator.updateAsync(RECONCILIATION, created);
                })
                .compose(updated -> operator.getAsync(NAMESPACE, SplunkToken.TOKEN_NAME))
                .onComplete(context.succeeding(token -> context.verify(() -> {
                    assertThat(token.getSpec().getName(), is("1234"));
                    assertThat(token.getSpec().getDefaultIndex(), is("new_index"));
                    assertThat(token.getSpec().getAllowedIndexes(), contains("new_index", "classic_index"));
                    assertThat(token.getMetadata().getFinalizers(), contains(SplunkToken.FINALIZER));
                    context.completeNow();
                })));
    }

    @Test
    public void testGetMissingToken(VertxTestContext context) {
        operator.getAsync(NAMESPACE, SplunkToken.TOKEN_NAME)
                .onComplete(context.succeeding(token -> context.verify(() -> {
                    assertThat(token, is(nullValue()));
                    context.completeNow();
                })));
    }
}
