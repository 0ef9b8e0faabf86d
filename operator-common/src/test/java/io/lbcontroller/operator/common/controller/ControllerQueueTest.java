/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.controller;

import io.lbcontroller.operator.common.BackOff;
import io.lbcontroller.operator.common.MetricsProvider;
import io.lbcontroller.operator.common.MicrometerMetricsProvider;
import io.lbcontroller.operator.common.metrics.ControllerMetricsHolder;
import io.lbcontroller.operator.common.model.LabelPredicate;
import io.lbcontroller.test.TestUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class ControllerQueueTest {
    private MeterRegistry metricsRegistry;
    private ControllerMetricsHolder metrics;
    private ScheduledExecutorService executor;

    @BeforeEach
    public void setup() {
        metricsRegistry = new SimpleMeterRegistry();
        MetricsProvider metricsProvider = new MicrometerMetricsProvider(metricsRegistry);
        metrics = new ControllerMetricsHolder("kind", LabelPredicate.EVERYTHING, metricsProvider);
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void teardown() {
        executor.shutdownNow();
    }

    @Test
    public void testEnqueueingEnqueued() {
        ControllerQueue q = new ControllerQueue(10, metrics);

        SimplifiedReconciliation r1 = new SimplifiedReconciliation("kind", "my-namespace", "my-name", "watch");
        SimplifiedReconciliation r2 = new SimplifiedReconciliation("kind", "my-namespace", "my-name", "timer");
        SimplifiedReconciliation r3 = new SimplifiedReconciliation("kind", "my-namespace", "my-other-name", "watch");

        q.enqueue(r1);
        q.enqueue(r3);
        q.enqueue(r2);

        assertThat(q.queue.size(), is(2));
        assertThat(q.queue.contains(r1), is(true));
        assertThat(q.queue.contains(r3), is(true));

        assertThat(metricsRegistry.get("lbc.reconciliations.already.enqueued").tag("kind", "kind").tag("namespace", "my-namespace").counter().count(), is(1.0));
    }

    @Test
    public void testFullQueue() {
        ControllerQueue q = new ControllerQueue(1, metrics);

        q.enqueue(new SimplifiedReconciliation("kind", "my-namespace", "my-name"));
        q.enqueue(new SimplifiedReconciliation("kind", "my-namespace", "my-other-name"));

        assertThat(q.queue.size(), is(1));
    }

    @Test
    public void testRetriesDisabled() {
        ControllerQueue q = new ControllerQueue(10, metrics);

        assertThat(q.enqueueWithBackOff(new SimplifiedReconciliation("kind", "my-namespace", "my-name")), is(false));
        assertThat(q.queue.isEmpty(), is(true));
    }

    @Test
    public void testEnqueueWithBackOff() throws InterruptedException {
        ControllerQueue q = new ControllerQueue(10, metrics, executor, () -> new BackOff(10, 2, 2));
        SimplifiedReconciliation r = new SimplifiedReconciliation("kind", "my-namespace", "my-name");

        assertThat(q.enqueueWithBackOff(r), is(true));
        TestUtils.waitFor("first retry", 10, 5_000, () -> q.queue.size() == 1);
        SimplifiedReconciliation retry = q.take();
        assertThat(retry, is(r));
        assertThat(retry.trigger(), is("retry"));

        assertThat(q.enqueueWithBackOff(r), is(true));
        TestUtils.waitFor("second retry", 10, 5_000, () -> q.queue.size() == 1);
        q.take();

        // Attempts are exhausted
        assertThat(q.enqueueWithBackOff(r), is(false));
        assertThat(q.backOffs.isEmpty(), is(true));

        assertThat(metricsRegistry.get("lbc.reconciliations.retried").tag("kind", "kind").tag("namespace", "my-namespace").counter().count(), is(2.0));
    }

    @Test
    public void testForgetResetsBackOff() {
        ControllerQueue q = new ControllerQueue(10, metrics, executor, () -> new BackOff(60_000, 2, 2));
        SimplifiedReconciliation r = new SimplifiedReconciliation("kind", "my-namespace", "my-name");

        assertThat(q.enqueueWithBackOff(r), is(true));
        assertThat(q.backOffs.get(r.lockName()).attempts(), is(1));

        q.forget(r);
        assertThat(q.backOffs.isEmpty(), is(true));

        assertThat(q.enqueueWithBackOff(r), is(true));
        assertThat(q.backOffs.get(r.lockName()).attempts(), is(1));
    }
}
