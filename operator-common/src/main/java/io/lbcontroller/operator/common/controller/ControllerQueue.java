/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.controller;

import io.lbcontroller.operator.common.BackOff;
import io.lbcontroller.operator.common.metrics.ControllerMetricsHolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Controller queue wraps a bounded blocking queue and exposes the methods used by controllers: taking events from the
 * queue, enqueueing events and re-enqueueing failed reconciliations with an exponential back-off.
 */
public class ControllerQueue {
    private final static Logger LOGGER = LogManager.getLogger(ControllerQueue.class);

    /*test*/ final BlockingQueue<SimplifiedReconciliation> queue;
    /*test*/ final Map<String, BackOff> backOffs = new ConcurrentHashMap<>();

    private final ControllerMetricsHolder metrics;
    private final ScheduledExecutorService scheduledExecutor;
    private final Supplier<BackOff> backOffSupplier;

    /**
     * Creates the controller queue without support for retries.
     *
     * @param queueSize     The capacity of the work queue
     * @param metrics       Holder for the controller metrics
     */
    public ControllerQueue(int queueSize, ControllerMetricsHolder metrics) {
        this(queueSize, metrics, null, null);
    }

    /**
     * Creates the controller queue.
     *
     * @param queueSize         The capacity of the work queue
     * @param metrics           Holder for the controller metrics
     * @param scheduledExecutor Executor used to re-enqueue failed reconciliations after their back-off delay
     * @param backOffSupplier   Creates the back-off for a resource when its reconciliation fails for the first time
     */
    public ControllerQueue(int queueSize, ControllerMetricsHolder metrics, ScheduledExecutorService scheduledExecutor, Supplier<BackOff> backOffSupplier) {
        this.queue = new ArrayBlockingQueue<>(queueSize);
        this.metrics = metrics;
        this.scheduledExecutor = scheduledExecutor;
        this.backOffSupplier = backOffSupplier;
    }

    /**
     * @return  Takes the next item from the queue. Blocks if the queue is empty.
     *
     * @throws InterruptedException InterruptedException is thrown if interrupted while waiting for the next item
     */
    public SimplifiedReconciliation take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Enqueues the next reconciliation. The event is added only when no reconciliation for the same resource is
     * already waiting in the queue.
     *
     * @param reconciliation    Reconciliation identifier
     */
    public void enqueue(SimplifiedReconciliation reconciliation)    {
        if (!queue.contains(reconciliation)) {
            LOGGER.debug("Enqueueing {}", reconciliation);
            if (!queue.offer(reconciliation))    {
                LOGGER.warn("Failed to enqueue {} because the controller queue is full", reconciliation);
            }
        } else {
            metrics.alreadyEnqueuedReconciliationsCounter(reconciliation.namespace).increment();
            LOGGER.debug("{} {} in namespace {} is already enqueued => ignoring", reconciliation.kind, reconciliation.name, reconciliation.namespace);
        }
    }

    /**
     * Schedules the reconciliation to be enqueued again after the next back-off delay of its resource. When the
     * back-off of the resource is exhausted, the reconciliation is not re-enqueued and the back-off is reset. The
     * resource will then be reconciled again with the next event or the next periodic reconciliation.
     *
     * @param reconciliation    Reconciliation which failed
     *
     * @return  True if the reconciliation was scheduled to be re-enqueued. False otherwise.
     */
    public boolean enqueueWithBackOff(SimplifiedReconciliation reconciliation) {
        if (scheduledExecutor == null || backOffSupplier == null) {
            LOGGER.debug("Retries are not enabled => {} will not be re-enqueued", reconciliation);
            return false;
        }

        long[] delay = {-1L};
        backOffs.compute(reconciliation.lockName(), (key, backOff) -> {
            BackOff current = backOff == null ? backOffSupplier.get() : backOff;

            if (current.done()) {
                return null;
            } else {
                delay[0] = current.delayMs();
                return current;
            }
        });

        if (delay[0] < 0) {
            LOGGER.warn("{} failed too many times and will not be retried before the next event or periodic reconciliation", reconciliation);
            return false;
        }

        try {
            LOGGER.debug("{} will be re-enqueued in {} ms", reconciliation, delay[0]);
            scheduledExecutor.schedule(() -> enqueue(reconciliation.withTrigger("retry")), delay[0], TimeUnit.MILLISECONDS);
            metrics.retriedReconciliationsCounter(reconciliation.namespace).increment();
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Scheduled executor is shut down => {} will not be re-enqueued", reconciliation);
            return false;
        }
    }

    /**
     * Resets the back-off of the resource. It should be called when a reconciliation succeeds.
     *
     * @param reconciliation    Reconciliation which succeeded
     */
    public void forget(SimplifiedReconciliation reconciliation) {
        backOffs.remove(reconciliation.lockName());
    }
}
