/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.openshift.splunktoken.operator.assembly.ClusterDeploymentReconciler;
import io.openshift.splunktoken.operator.assembly.SplunkTokenReconciler;
import io.openshift.splunktoken.operator.common.MetricsProvider;
import io.openshift.splunktoken.operator.common.MicrometerMetricsProvider;
import io.openshift.splunktoken.operator.common.OperatorMetricsHolder;
import io.openshift.splunktoken.operator.common.ShutdownHook;
import io.openshift.splunktoken.operator.resource.ResourceOperatorSupplier;
import io.openshift.splunktoken.operator.splunk.SplunkAcsClient;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * The main class used to start the Splunk Token Operator
 */
@SuppressFBWarnings("DM_EXIT")
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class.getName());

    private static final int HEALTH_SERVER_PORT = 8080;
    private static final long SHUTDOWN_TIMEOUT = 10_000L;

    /**
     * The main method used to run the Splunk Token Operator
     *
     * @param args  The command line arguments
     */
    public static void main(String[] args) {
        final String version = Main.class.getPackage().getImplementationVersion();
        LOGGER.info("SplunkTokenOperator {} is starting", version);
        TokenOperatorConfig config = TokenOperatorConfig.buildFromMap(System.getenv());
        LOGGER.info("Splunk Token Operator configuration is {}", config);

        // Shutdown hook to register shutdown actions
        ShutdownHook shutdownHook = new ShutdownHook();
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));

        Vertx vertx = Vertx.vertx();
        shutdownHook.register(() -> ShutdownHook.shutdownVertx(vertx, SHUTDOWN_TIMEOUT));

        MetricsProvider metricsProvider = new MicrometerMetricsProvider(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
        KubernetesClient client = new KubernetesClientBuilder().build();
        shutdownHook.register(client::close);

        SplunkAcsClient splunk = new SplunkAcsClient(vertx, config.getAcsUrl(), config.getSplunkInstance(),
                config.getSplunkAuthToken(), config.getOperationTimeoutMs());

        startHealthServer(vertx, metricsProvider)
                .compose(i -> deployTokenOperatorVerticles(vertx, client, splunk, metricsProvider, config, shutdownHook))
                .onComplete(res -> {
                    if (res.failed())   {
                        LOGGER.error("Unable to start operator for 1 or more namespace", res.cause());
                        vertx.executeBlocking(() -> {
                            System.exit(1);
                            return true;
                        });
                    }
                });
    }

    /**
     * Deploys the TokenOperator verticles. One verticle is started for each watched namespace. In case of watching
     * the whole cluster, only one verticle is started.
     *
     * @param vertx             Vertx instance
     * @param client            Kubernetes client instance
     * @param splunk            Splunk ACS client
     * @param metricsProvider   Metrics provider instance
     * @param config            Operator configuration
     * @param shutdownHook      Shutdown hook to register the undeployment of the verticles
     *
     * @return  Future which completes when all verticles are started and running
     */
    static Future<Void> deployTokenOperatorVerticles(Vertx vertx, KubernetesClient client, SplunkAcsClient splunk,
                                                     MetricsProvider metricsProvider, TokenOperatorConfig config,
                                                     ShutdownHook shutdownHook) {
        ResourceOperatorSupplier resourceOperatorSupplier = new ResourceOperatorSupplier(vertx, client);
        ClusterDeploymentReconciler clusterDeploymentReconciler = new ClusterDeploymentReconciler(config, resourceOperatorSupplier);
        SplunkTokenReconciler splunkTokenReconciler = new SplunkTokenReconciler(config, resourceOperatorSupplier, splunk);
        OperatorMetricsHolder metrics = new OperatorMetricsHolder(metricsProvider);

        List<Future<String>> futures = new ArrayList<>(config.getNamespaces().size());
        for (String namespace : config.getNamespaces()) {
            Promise<String> prom = Promise.promise();
            futures.add(prom.future());
            TokenOperator operator = new TokenOperator(namespace,
                    config,
                    resourceOperatorSupplier,
                    clusterDeploymentReconciler,
                    splunkTokenReconciler,
                    metrics);
            vertx.deployVerticle(operator).onComplete(res -> {
                if (res.succeeded()) {
                    shutdownHook.register(() -> ShutdownHook.undeployVertxVerticle(vertx, res.result(), SHUTDOWN_TIMEOUT));
                    LOGGER.info("Token Operator verticle started in namespace {}", namespace);
                } else {
                    LOGGER.error("Token Operator verticle in namespace {} failed to start", namespace, res.cause());
                }
                prom.handle(res);
            });
        }

        // The ACS client is closed after the verticles are undeployed
        shutdownHook.register(splunk::close);

        return Future.join(futures).mapEmpty();
    }

    /**
     * Start an HTTP health and metrics server
     *
     * @param vertx             Vertx instance
     * @param metricsProvider   Metrics Provider to get the metrics from
     *
     * @return Future which completes when the health and metrics webserver is started
     */
    private static Future<HttpServer> startHealthServer(Vertx vertx, MetricsProvider metricsProvider) {
        Promise<HttpServer> result = Promise.promise();

        vertx.createHttpServer()
                .requestHandler(request -> {
                    if (request.path().equals("/healthy")) {
                        request.response().setStatusCode(204).end();
                    } else if (request.path().equals("/ready")) {
                        request.response().setStatusCode(204).end();
                    } else if (request.path().equals("/metrics")) {
                        PrometheusMeterRegistry metrics = (PrometheusMeterRegistry) metricsProvider.meterRegistry();
                        request.response()
                                .putHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                                .setStatusCode(200)
                                .end(metrics.scrape());
                    } else {
                        request.response().setStatusCode(404).end();
                    }
                })
                .listen(HEALTH_SERVER_PORT).onComplete(ar -> {
                    if (ar.succeeded()) {
                        LOGGER.info("Health and metrics server is ready on port {}", HEALTH_SERVER_PORT);
                    } else {
                        LOGGER.error("Failed to start health and metrics webserver on port {}", HEALTH_SERVER_PORT, ar.cause());
                    }
                    result.handle(ar);
                });

        return result.future();
    }
}
