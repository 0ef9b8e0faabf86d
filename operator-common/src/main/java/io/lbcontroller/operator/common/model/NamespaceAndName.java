/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.model;

/**
 * Namespace and name of a Kubernetes object
 *
 * @param namespace     Namespace
 * @param name          Name
 */
public record NamespaceAndName(String namespace, String name) {
    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
