/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.targetgroup;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.networking.reconcile.GrantFailureException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DefaultTargetGroupReconcilerTest {
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", "TargetGroupBinding", "my-namespace", "my-tgb");
    private static final String ARN = "arn:aws:elasticloadbalancing:eu-west-1:123456789012:targetgroup/my-tg/0123456789abcdef";

    @Test
    public void testRegistersAndDeregisters() {
        RecordingTargetGroupManager manager = new RecordingTargetGroupManager(List.of(Target.of("10.0.1.10", 8080), Target.of("10.0.1.11", 8080)));

        new DefaultTargetGroupReconciler(manager).reconcileTargets(RECONCILIATION, ARN,
                List.of(Target.of("10.0.1.11", 8080), Target.of("10.0.1.12", 8080)));

        assertThat(manager.log, is(List.of("deregister [10.0.1.10:8080]", "register [10.0.1.12:8080]")));
        assertThat(manager.targets, containsInAnyOrder(Target.of("10.0.1.11", 8080), Target.of("10.0.1.12", 8080)));
    }

    @Test
    public void testAvailabilityZoneIsIgnored() {
        RecordingTargetGroupManager manager = new RecordingTargetGroupManager(List.of(new Target("10.0.1.10", 8080, "eu-west-1a")));

        new DefaultTargetGroupReconciler(manager).reconcileTargets(RECONCILIATION, ARN, List.of(Target.of("10.0.1.10", 8080)));

        assertThat(manager.log, is(empty()));
    }

    @Test
    public void testPortChangeReplacesTarget() {
        RecordingTargetGroupManager manager = new RecordingTargetGroupManager(List.of(Target.of("10.0.1.10", 8080)));

        new DefaultTargetGroupReconciler(manager).reconcileTargets(RECONCILIATION, ARN, List.of(Target.of("10.0.1.10", 9090)));

        assertThat(manager.log, is(List.of("deregister [10.0.1.10:8080]", "register [10.0.1.10:9090]")));
    }

    @Test
    public void testFailedRegistrationIsRepairedByNextPass() {
        RecordingTargetGroupManager manager = new RecordingTargetGroupManager(List.of());
        manager.failRegister = true;
        DefaultTargetGroupReconciler reconciler = new DefaultTargetGroupReconciler(manager);

        assertThrows(GrantFailureException.class, () -> reconciler.reconcileTargets(RECONCILIATION, ARN, List.of(Target.of("10.0.1.10", 8080))));

        manager.failRegister = false;
        manager.log.clear();
        reconciler.reconcileTargets(RECONCILIATION, ARN, List.of(Target.of("10.0.1.10", 8080)));
        reconciler.reconcileTargets(RECONCILIATION, ARN, List.of(Target.of("10.0.1.10", 8080)));

        assertThat(manager.log, is(List.of("register [10.0.1.10:8080]")));
    }

    static class RecordingTargetGroupManager implements TargetGroupManager {
        final List<Target> targets;
        final List<String> log = new ArrayList<>();
        boolean failRegister = false;

        RecordingTargetGroupManager(List<Target> targets) {
            this.targets = new ArrayList<>(targets);
        }

        @Override
        public List<Target> fetchTargets(Reconciliation reconciliation, String targetGroupArn) {
            return List.copyOf(targets);
        }

        @Override
        public void deregisterTargets(Reconciliation reconciliation, String targetGroupArn, List<Target> toDeregister) {
            log.add("deregister " + describe(toDeregister));
            toDeregister.forEach(t -> targets.removeIf(existing -> TargetEquality.INSTANCE.equivalent(existing, t)));
        }

        @Override
        public void registerTargets(Reconciliation reconciliation, String targetGroupArn, List<Target> toRegister) {
            if (failRegister) {
                throw new GrantFailureException(targetGroupArn, "TooManyRegistrationsForTargetId");
            }

            log.add("register " + describe(toRegister));
            targets.addAll(toRegister);
        }

        private static List<String> describe(List<Target> targets) {
            return targets.stream().map(t -> t.id() + ":" + t.port()).toList();
        }
    }
}
