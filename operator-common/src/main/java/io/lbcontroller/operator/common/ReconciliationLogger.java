/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.spi.AbstractLogger;
import org.apache.logging.log4j.spi.ExtendedLoggerWrapper;

import java.io.Serializable;

/**
 * Logger wrapper with two families of methods:
 *
 * <ul>
 *     <li>{@code *Cr} methods log in the context of a {@link Reconciliation}. The message is prefixed with the
 *     reconciliation description and the reconciliation marker is attached to the log event.</li>
 *     <li>{@code *Op} methods log operator-level messages without any reconciliation context.</li>
 * </ul>
 *
 * As with the regular Log4j 2 API, a {@link Throwable} passed as the last parameter is logged as the exception.
 */
public class ReconciliationLogger implements Serializable {
    private static final long serialVersionUID = 258810740149174L;

    private static final String FQCN = ReconciliationLogger.class.getName();

    /**
     * Wrapped logger which we extend
     */
    private final ExtendedLoggerWrapper logger;

    protected ReconciliationLogger(final Logger logger) {
        this.logger = new ExtendedLoggerWrapper((AbstractLogger) logger, logger.getName(), logger.getMessageFactory());
    }

    /**
     * Returns a custom Logger using the fully qualified name of the Class as the Logger name.
     *
     * @param loggerName The Class whose name should be used as the Logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final Class<?> loggerName) {
        return new ReconciliationLogger(LogManager.getLogger(loggerName));
    }

    /**
     * Returns a custom Logger with the specified name.
     *
     * @param name The logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final String name) {
        return new ReconciliationLogger(LogManager.getLogger(name));
    }

    /**
     * @return  True if the DEBUG level is enabled for this logger
     */
    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    ////// Reconciliation logging

    /**
     * Logs a message with parameters at the {@code TRACE} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void traceCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.TRACE, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void debugCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.DEBUG, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void infoCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.INFO, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void warnCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.WARN, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void errorCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.ERROR, reconciliation, message, params);
    }

    private void logCr(final Level level, final Reconciliation reconciliation, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, level, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    ////// Operator logging

    /**
     * Logs a message with parameters at the {@code DEBUG} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void debugOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.DEBUG, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void infoOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.INFO, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void warnOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.WARN, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void errorOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.ERROR, null, message, params);
    }
}
