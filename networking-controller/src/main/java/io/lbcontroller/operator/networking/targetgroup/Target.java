/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.targetgroup;

import java.util.Objects;

/**
 * Target registered in a target group
 *
 * @param id                Instance ID or IP address
 * @param port              Port on which the target receives traffic, null for the default port of the target group
 * @param availabilityZone  Availability zone, null unless the target is outside of the VPC
 */
public record Target(String id, Integer port, String availabilityZone) {
    /**
     * Constructor
     *
     * @param id                Instance ID or IP address
     * @param port              Port of the target
     * @param availabilityZone  Availability zone
     */
    public Target {
        Objects.requireNonNull(id, "id");
    }

    /**
     * @param id    Instance ID or IP address
     * @param port  Port
     *
     * @return  Target without an explicit availability zone
     */
    public static Target of(String id, Integer port) {
        return new Target(id, port, null);
    }
}
