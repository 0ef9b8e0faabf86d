/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.controller;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationCancelledException;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.common.metrics.ControllerMetricsHolder;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Abstract controller loop provides the shared functionality for reconciling resources. It takes events from the
 * work queue, makes sure the same resource is never reconciled in parallel and handles the outcome of the
 * reconciliation:
 *
 * <ul>
 *     <li>Success resets the retry back-off of the resource</li>
 *     <li>Cancellation is logged without being treated as an error and is not retried</li>
 *     <li>Any other failure is logged and re-enqueued with a back-off</li>
 * </ul>
 */
public abstract class AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractControllerLoop.class);
    private static final long PROGRESS_WARNING_MS = 60_000L;

    private final String name;
    private final Thread controllerThread;
    private final ControllerQueue workQueue;
    private final ReconciliationLockManager lockManager;
    private final ScheduledExecutorService scheduledExecutor;

    private volatile boolean stop = false;
    private volatile boolean running = false;

    /**
     * Creates the controller loop.
     *
     * @param name                  The name of this controller loop. The name should help to identify what kind
     *                              of loop this is and what it reconciles.
     * @param workQueue             Queue from which events should be consumed
     * @param lockManager           Lock manager for making sure no parallel reconciliations for a given resource can happen
     * @param scheduledExecutor     Scheduled executor service used to run the progress warnings
     */
    public AbstractControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager, ScheduledExecutorService scheduledExecutor) {
        this.name = name;
        this.workQueue = workQueue;
        this.lockManager = lockManager;
        this.scheduledExecutor = scheduledExecutor;
        this.controllerThread = new Thread(new Runner(), name);
    }

    /**
     * The main reconciliation logic. Any exception thrown from this method is considered a failed reconciliation,
     * except for {@link ReconciliationCancelledException}.
     *
     * @param reconciliation    Reconciliation identifier used for logging
     */
    protected abstract void reconcile(Reconciliation reconciliation);

    /**
     * Returns the Controller Metrics Holder instance, which is used to hold the various controller metrics
     *
     * @return Controller metrics holder instance
     */
    protected abstract ControllerMetricsHolder metrics();

    /**
     * Starts the controller: this method creates a new thread in which the controller will run
     */
    public void start() {
        LOGGER.debugOp("{}: Starting the controller loop", name);
        controllerThread.start();
    }

    /**
     * Stops the controller: this method sets the stop flag and interrupts the run loop. A reconciliation in progress
     * is interrupted as well.
     *
     * @throws InterruptedException InterruptedException is thrown when interrupted while joining the thread
     */
    public void stop() throws InterruptedException {
        LOGGER.infoOp("{}: Requesting the controller loop to stop", name);
        this.stop = true;
        controllerThread.interrupt();
        controllerThread.join();
    }

    /**
     * @return  True when the controller is in the run loop, false otherwise
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * @return  True when the controller loop thread is alive, false otherwise
     */
    public boolean isAlive() {
        return controllerThread.isAlive();
    }

    /**
     * Obtains the lock for the resource or re-queues the reconciliation if the lock is held by another loop.
     *
     * @param reconciliation    Reconciliation marker
     */
    private void reconcileWithLock(SimplifiedReconciliation reconciliation) {
        String lockName = reconciliation.lockName();
        boolean requeue = false;

        try {
            boolean locked = lockManager.tryLock(lockName, 1_000, TimeUnit.MILLISECONDS);

            if (locked) {
                try {
                    reconcileWrapper(reconciliation);
                } finally {
                    lockManager.unlock(lockName);
                }
            } else {
                LOGGER.warnOp("{}: Failed to acquire lock {}. The resource will be re-queued for later.", name, lockName);
                metrics().lockedReconciliationsCounter(reconciliation.namespace).increment();
                requeue = true;
            }
        } catch (InterruptedException e) {
            LOGGER.warnOp("{}: Interrupted while trying to acquire lock {}. The resource will be re-queued for later.", name, lockName);
            metrics().lockedReconciliationsCounter(reconciliation.namespace).increment();
            Thread.currentThread().interrupt();
            requeue = true;
        }

        if (requeue) {
            workQueue.enqueue(reconciliation);
        }
    }

    /**
     * Runs the reconciliation with progress warnings and metrics and handles its outcome.
     *
     * @param item    Queued reconciliation
     */
    private void reconcileWrapper(SimplifiedReconciliation item) {
        Reconciliation reconciliation = item.toReconciliation();

        ScheduledFuture<?> progressWarning = scheduledExecutor
                .scheduleAtFixedRate(() -> LOGGER.infoCr(reconciliation, "Reconciliation is in progress for {} ms", reconciliation.elapsedMs()), PROGRESS_WARNING_MS, PROGRESS_WARNING_MS, TimeUnit.MILLISECONDS);
        metrics().reconciliationsCounter(reconciliation.namespace()).increment();
        Timer.Sample reconciliationTimerSample = Timer.start(metrics().metricsProvider().meterRegistry());

        try {
            reconcile(reconciliation);
            LOGGER.infoCr(reconciliation, "reconciled in {} ms", reconciliation.elapsedMs());
            metrics().successfulReconciliationsCounter(reconciliation.namespace()).increment();
            workQueue.forget(item);
        } catch (ReconciliationCancelledException e) {
            LOGGER.infoCr(reconciliation, "Reconciliation was cancelled: {}", e.getMessage());
            metrics().cancelledReconciliationsCounter(reconciliation.namespace()).increment();
        } catch (RuntimeException e) {
            LOGGER.errorCr(reconciliation, "{} {} in namespace {} reconciliation failed", reconciliation.kind(), reconciliation.name(), reconciliation.namespace(), e);
            metrics().failedReconciliationsCounter(reconciliation.namespace()).increment();
            workQueue.enqueueWithBackOff(item);
        } finally   {
            reconciliationTimerSample.stop(metrics().reconciliationsTimer(reconciliation.namespace()));
            progressWarning.cancel(true);
        }
    }

    /**
     * Runs the controller loop. Implemented as a private inner class to not expose the run method.
     */
    private class Runner implements Runnable {
        @Override
        public void run() {
            LOGGER.debugOp("{}: Starting", name);
            running = true;

            while (!stop) {
                try {
                    LOGGER.debugOp("{}: Waiting for next event from work queue", name);
                    SimplifiedReconciliation reconciliation = workQueue.take();
                    reconcileWithLock(reconciliation);
                    // Clear a stale interrupt which did not come from stop()
                    if (!stop && Thread.interrupted()) {
                        LOGGER.debugOp("{}: Reconciliation was interrupted", name);
                    }
                } catch (InterruptedException e) {
                    LOGGER.debugOp("{}: was interrupted", name, e);
                } catch (Exception e) {
                    LOGGER.warnOp("{}: reconciliation failed", name, e);
                }
            }

            LOGGER.infoOp("{}: Stopping", name);
            running = false;
        }
    }
}
