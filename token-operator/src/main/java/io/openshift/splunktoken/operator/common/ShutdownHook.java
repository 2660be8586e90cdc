/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the registered shutdown actions in the reverse order of their registration when the JVM shuts down
 */
public class ShutdownHook implements Runnable {
    private static final Logger LOGGER = LogManager.getLogger(ShutdownHook.class);

    private final Deque<Runnable> actions = new ArrayDeque<>();

    /**
     * Registers a shutdown action
     *
     * @param action    Action to run on shutdown
     */
    public synchronized void register(Runnable action) {
        actions.push(action);
    }

    @Override
    public synchronized void run() {
        LOGGER.info("Shutdown hook started");

        while (!actions.isEmpty()) {
            Runnable action = actions.pop();
            try {
                action.run();
            } catch (RuntimeException e) {
                LOGGER.error("Shutdown action failed", e);
            }
        }

        LOGGER.info("Shutdown hook completed");
    }

    /**
     * Closes the Vert.x instance and waits until it is closed
     *
     * @param vertx     Vert.x instance
     * @param timeoutMs How long to wait for Vert.x to close
     */
    public static void shutdownVertx(Vertx vertx, long timeoutMs) {
        LOGGER.info("Shutting down Vertx");
        CountDownLatch latch = new CountDownLatch(1);

        vertx.close().onComplete(ar -> {
            if (ar.failed()) {
                LOGGER.error("Vertx close failed", ar.cause());
            }
            latch.countDown();
        });

        awaitQuietly(latch, timeoutMs, "Vertx close");
    }

    /**
     * Undeploys a verticle and waits until it is undeployed
     *
     * @param vertx         Vert.x instance
     * @param deploymentId  ID of the verticle deployment
     * @param timeoutMs     How long to wait for the undeployment
     */
    public static void undeployVertxVerticle(Vertx vertx, String deploymentId, long timeoutMs) {
        LOGGER.info("Undeploying verticle {}", deploymentId);
        CountDownLatch latch = new CountDownLatch(1);

        vertx.undeploy(deploymentId).onComplete(ar -> {
            if (ar.failed()) {
                LOGGER.error("Undeployment of verticle {} failed", deploymentId, ar.cause());
            }
            latch.countDown();
        });

        awaitQuietly(latch, timeoutMs, "Verticle undeployment");
    }

    private static void awaitQuietly(CountDownLatch latch, long timeoutMs, String action) {
        try {
            if (!latch.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{} did not complete within {}ms", action, timeoutMs);
            }
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted while waiting for {}", action);
            Thread.currentThread().interrupt();
        }
    }
}
