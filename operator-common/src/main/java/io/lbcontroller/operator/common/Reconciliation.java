/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common;

import io.lbcontroller.operator.common.model.NamespaceAndName;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One pass converging the cloud resources owned by a Kubernetes object (the rules of a Service's security group, the
 * targets of a TargetGroupBinding) towards the state computed from that object. A pass is identified by a sequence
 * number and carries what triggered it, so every log line of the pass can be correlated.
 */
public class Reconciliation {
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    /**
     * Reconciliation used by tests which do not care about the reconciled object
     */
    public static final Reconciliation DUMMY_RECONCILIATION = new Reconciliation("test", "kind", "namespace", "name");

    private final int sequence = SEQUENCE.getAndIncrement();
    private final long startNanos = System.nanoTime();
    private final String trigger;
    private final String kind;
    private final NamespaceAndName resource;
    private final Marker marker;

    /**
     * Creates a reconciliation of a namespaced object
     *
     * @param trigger       What started this pass (watch, timer, retry, ...)
     * @param kind          Kind of the object
     * @param resource      Namespace and name of the object
     */
    public Reconciliation(String trigger, String kind, NamespaceAndName resource) {
        this.trigger = trigger;
        this.kind = kind;
        this.resource = resource;
        this.marker = MarkerManager.getMarker(kind + "(" + resource + ")");
    }

    /**
     * Creates a reconciliation of a namespaced object
     *
     * @param trigger       What started this pass (watch, timer, retry, ...)
     * @param kind          Kind of the object
     * @param namespace     Namespace of the object
     * @param name          Name of the object
     */
    public Reconciliation(String trigger, String kind, String namespace, String name) {
        this(trigger, kind, new NamespaceAndName(namespace, name));
    }

    public String trigger() {
        return trigger;
    }

    public String kind() {
        return kind;
    }

    /**
     * @return  Namespace and name of the reconciled object, the key under which its desired state is looked up
     */
    public NamespaceAndName resource() {
        return resource;
    }

    public String namespace() {
        return resource.namespace();
    }

    public String name() {
        return resource.name();
    }

    /**
     * @return  Milliseconds since this pass was created
     */
    public long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * @return  Log4j marker of the reconciled object
     */
    public Marker getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return "Reconciliation #" + sequence + "(" + trigger + ") " + kind + "(" + resource + ")";
    }
}
