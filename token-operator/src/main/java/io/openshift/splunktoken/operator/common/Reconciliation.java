/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identifies a single reconciliation of a resource. Used to correlate the log messages of one reconciliation pass.
 */
public class Reconciliation {
    private static final AtomicInteger IDS = new AtomicInteger();

    private final String trigger;
    private final String kind;
    private final String namespace;
    private final String name;
    private final int id;
    private final Marker marker;

    /**
     * Constructor
     *
     * @param trigger   What triggered the reconciliation (watch, timer, ...)
     * @param kind      Kind of the reconciled resource
     * @param namespace Namespace of the reconciled resource
     * @param name      Name of the reconciled resource
     */
    public Reconciliation(String trigger, String kind, String namespace, String name) {
        this.trigger = trigger;
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.id = IDS.getAndIncrement();
        this.marker = MarkerManager.getMarker(kind + "(" + namespace + "/" + name + ")");
    }

    public String trigger() {
        return trigger;
    }

    public String kind() {
        return kind;
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    public int id() {
        return id;
    }

    /**
     * @return  Log4j marker identifying the reconciled resource
     */
    public Marker getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return "Reconciliation #" + id + "(" + trigger + ") " + kind + "(" + namespace + "/" + name + ")";
    }
}
