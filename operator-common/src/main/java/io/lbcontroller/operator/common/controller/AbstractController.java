/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.controller;

import io.lbcontroller.operator.common.BackOff;
import io.lbcontroller.operator.common.MetricsProvider;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.common.metrics.ControllerMetricsHolder;
import io.lbcontroller.operator.common.model.LabelPredicate;
import io.lbcontroller.operator.common.model.NamespaceAndName;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Controller is responsible for queueing the reconciliations of one kind of resources. The reconciliations are
 * triggered from the outside (for example by a watch on the Kubernetes resources) through the {@code enqueue} methods
 * and periodically for all resources known to the controller. The actual processing of the events is done by the
 * controller loops. The number of controller loops limits how many reconciliations of this kind run in parallel.
 */
public abstract class AbstractController {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractController.class);

    private final String kind;
    private final int loopCount;
    private final long resyncIntervalMs;
    private final ControllerMetricsHolder metrics;
    private final ControllerQueue workQueue;
    private final ReconciliationLockManager lockManager;
    private final ScheduledExecutorService scheduledExecutor;
    private final List<AbstractControllerLoop> threadPool;

    /**
     * Creates the controller
     *
     * @param kind                  Kind of the resources reconciled by this controller
     * @param loopCount             Number of controller loops (maximum number of parallel reconciliations)
     * @param workQueueSize         Size of the work queue
     * @param resyncIntervalMs      Interval of the periodic reconciliation of all known resources
     * @param retryMaxAttempts      Number of times a failed reconciliation is retried with a back-off
     * @param selector              Selector used by this controller, used to tag the metrics
     * @param metricsProvider       Metrics provider
     */
    protected AbstractController(String kind, int loopCount, int workQueueSize, long resyncIntervalMs, int retryMaxAttempts,
                                 LabelPredicate selector, MetricsProvider metricsProvider) {
        this.kind = kind;
        this.loopCount = loopCount;
        this.resyncIntervalMs = resyncIntervalMs;
        this.metrics = new ControllerMetricsHolder(kind, selector, metricsProvider);
        this.scheduledExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, kind + "ControllerScheduledExecutor"));
        this.workQueue = new ControllerQueue(workQueueSize, metrics, scheduledExecutor, () -> new BackOff(retryMaxAttempts));
        this.lockManager = new ReconciliationLockManager();
        this.threadPool = new ArrayList<>(loopCount);
    }

    /**
     * Creates a single controller loop.
     *
     * @param name              Name of the loop thread
     * @param workQueue         Work queue shared by all loops of this controller
     * @param lockManager       Lock manager shared by all loops of this controller
     * @param scheduledExecutor Scheduled executor for the progress warnings
     * @param metrics           Metrics holder
     *
     * @return  The new controller loop
     */
    protected abstract AbstractControllerLoop createLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager,
                                                         ScheduledExecutorService scheduledExecutor, ControllerMetricsHolder metrics);

    /**
     * @return  All resources which should be reconciled by the periodic reconciliation
     */
    protected abstract Set<NamespaceAndName> knownResources();

    /**
     * Enqueues a reconciliation of a resource triggered by a watch event
     *
     * @param namespace     Namespace of the resource
     * @param name          Name of the resource
     */
    public void enqueue(String namespace, String name) {
        enqueue(namespace, name, "watch");
    }

    /**
     * Enqueues a reconciliation of a resource
     *
     * @param namespace     Namespace of the resource
     * @param name          Name of the resource
     * @param trigger       What triggered the reconciliation
     */
    public void enqueue(String namespace, String name, String trigger) {
        LOGGER.debugOp("{} {} in namespace {} enqueued by {}", kind, name, namespace, trigger);
        workQueue.enqueue(new SimplifiedReconciliation(kind, namespace, name, trigger));
    }

    /**
     * Starts the controller loops and the periodic reconciliation
     */
    public void start() {
        LOGGER.infoOp("Starting {} controller loops", kind);
        for (int i = 0; i < loopCount; i++) {
            AbstractControllerLoop loop = createLoop(kind + "-ControllerLoop-" + i, workQueue, lockManager, scheduledExecutor, metrics);
            threadPool.add(loop);
            loop.start();
        }

        if (resyncIntervalMs > 0) {
            scheduledExecutor.scheduleAtFixedRate(new PeriodicReconciliation(), resyncIntervalMs, resyncIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stops the controller and all its controller loop threads. Reconciliations in progress are interrupted.
     */
    public void stop() {
        LOGGER.infoOp("Stopping {} scheduled executor service", kind);
        scheduledExecutor.shutdownNow();

        LOGGER.infoOp("Stopping {} controller loops", kind);
        threadPool.forEach(t -> {
            try {
                t.stop();
            } catch (InterruptedException e) {
                LOGGER.debugOp("Interrupted while stopping controller loop", e);
                Thread.currentThread().interrupt();
            }
        });
    }

    /**
     * Indicates whether the controller is ready or not. It is considered ready, when all controller loops are running.
     *
     * @return  True when the controller is ready, false otherwise
     */
    public boolean isReady() {
        boolean ready = !threadPool.isEmpty();

        for (AbstractControllerLoop t : threadPool) {
            ready &= t.isRunning();
        }

        return ready;
    }

    /**
     * Indicates whether the controller is alive or not. It is considered alive when all controller loop threads are
     * alive.
     *
     * @return  True when the controller loop threads are alive, false otherwise
     */
    public boolean isAlive() {
        boolean alive = !threadPool.isEmpty();

        for (AbstractControllerLoop t : threadPool) {
            alive &= t.isAlive();
        }

        return alive;
    }

    /**
     * @return  The metrics holder of this controller
     */
    public ControllerMetricsHolder metrics() {
        return metrics;
    }

    /**
     * Enqueues all resources known to the controller
     */
    /* test */ void resync() {
        LOGGER.infoOp("Triggering periodic reconciliation of {} resources", kind);
        metrics.periodicReconciliationsCounter("*").increment();

        try {
            knownResources().forEach(resource -> enqueue(resource.namespace(), resource.name(), "timer"));
        } catch (RuntimeException e) {
            LOGGER.errorOp("Periodic reconciliation of {} resources failed", kind, e);
        }
    }

    /**
     * Internal timer task which queues all known resources for reconciliation.
     */
    class PeriodicReconciliation implements Runnable {
        @Override
        public void run() {
            resync();
        }
    }
}
