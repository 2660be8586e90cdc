/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wraps a Log4j logger and prefixes the messages logged within a reconciliation with the reconciliation details.
 * The reconciliation marker is attached to every message so that it can be used for filtering.
 */
public class ReconciliationLogger {
    private final Logger logger;

    private ReconciliationLogger(Logger logger) {
        this.logger = logger;
    }

    /**
     * Creates a new reconciliation logger
     *
     * @param clazz     Class used for the logger name
     *
     * @return  New reconciliation logger
     */
    public static ReconciliationLogger create(Class<?> clazz) {
        return new ReconciliationLogger(LogManager.getLogger(clazz));
    }

    /**
     * Creates a new reconciliation logger
     *
     * @param name      Logger name
     *
     * @return  New reconciliation logger
     */
    public static ReconciliationLogger create(String name) {
        return new ReconciliationLogger(LogManager.getLogger(name));
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    public void traceCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.TRACE, reconciliation, message, params);
    }

    public void debugCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.DEBUG, reconciliation, message, params);
    }

    public void infoCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.INFO, reconciliation, message, params);
    }

    public void warnCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.WARN, reconciliation, message, params);
    }

    public void errorCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.ERROR, reconciliation, message, params);
    }

    /**
     * Logs an error together with its cause
     *
     * @param reconciliation    Reconciliation in which the error happened
     * @param message           Error message
     * @param cause             Cause of the error
     */
    public void errorCr(Reconciliation reconciliation, String message, Throwable cause) {
        if (logger.isErrorEnabled()) {
            logger.error(reconciliation.getMarker(), reconciliation + ": " + message, cause);
        }
    }

    private void logCr(Level level, Reconciliation reconciliation, String message, Object... params) {
        if (logger.isEnabled(level)) {
            logger.log(level, reconciliation.getMarker(), reconciliation + ": " + message, params);
        }
    }
}
