/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.controller;

import io.lbcontroller.operator.common.Reconciliation;

/**
 * Work queue item used instead of the regular Reconciliation class. Its equals implementation ignores the trigger so
 * that the same resource is never queued twice. It doesn't yet request the reconciliation ID. The IDs are issued only
 * when a reconciliation really starts which keeps them linear.
 */
public class SimplifiedReconciliation {
    final String kind;
    final String namespace;
    final String name;
    final String trigger;

    /**
     * SimplifiedReconciliation constructor with default (watch) trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     */
    public SimplifiedReconciliation(String kind, String namespace, String name) {
        this(kind, namespace, name, "watch");
    }

    /**
     * SimplifiedReconciliation constructor with custom trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     * @param trigger   Type of the trigger
     */
    public SimplifiedReconciliation(String kind, String namespace, String name, String trigger) {
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.trigger = trigger;
    }

    /**
     * @return  Namespace of the resource
     */
    public String namespace() {
        return namespace;
    }

    /**
     * @return  Name of the resource
     */
    public String name() {
        return name;
    }

    /**
     * @return  Trigger of this reconciliation
     */
    public String trigger() {
        return trigger;
    }

    /**
     * Converts the simplified reconciliation to a proper reconciliation
     *
     * @return Reconciliation object
     */
    public Reconciliation toReconciliation() {
        return new Reconciliation(trigger, kind, namespace, name);
    }

    /**
     * Creates a copy of this reconciliation with a different trigger
     *
     * @param newTrigger    The new trigger
     *
     * @return  New SimplifiedReconciliation for the same resource
     */
    public SimplifiedReconciliation withTrigger(String newTrigger) {
        return new SimplifiedReconciliation(kind, namespace, name, newTrigger);
    }

    /**
     * Generates a lock name for this reconciliation and its resource. The lock name consists of the kind, namespace
     * and name.
     *
     * @return Name of the lock which should be used for this resource
     */
    public String lockName() {
        return kind + "::" + namespace + "::" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            SimplifiedReconciliation reconciliation = (SimplifiedReconciliation) o;

            return this.kind.equals(reconciliation.kind)
                    && this.name.equals(reconciliation.name)
                    && this.namespace.equals(reconciliation.namespace);
        }
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + (kind != null ? kind.hashCode() : 0);
        result = 31 * result + (name != null ? name.hashCode() : 0);
        result = 31 * result + (namespace != null ? namespace.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return kind + "(" + namespace + "/" + name + ") triggered by " + trigger;
    }
}
