/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.targetgroup;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationCancelledException;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.networking.reconcile.FetchFailureException;
import io.lbcontroller.operator.networking.reconcile.GrantFailureException;
import io.lbcontroller.operator.networking.reconcile.RevokeFailureException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeregisterTargetsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetHealthRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetHealthResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RegisterTargetsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetDescription;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthDescription;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthStateEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Target group manager backed by the Elastic Load Balancing v2 API
 */
public class Elbv2TargetGroupManager implements TargetGroupManager {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(Elbv2TargetGroupManager.class);

    private final ElasticLoadBalancingV2Client elbv2Client;

    /**
     * Constructor
     *
     * @param elbv2Client   Configured ELBv2 client
     */
    public Elbv2TargetGroupManager(ElasticLoadBalancingV2Client elbv2Client) {
        this.elbv2Client = elbv2Client;
    }

    @Override
    public List<Target> fetchTargets(Reconciliation reconciliation, String targetGroupArn) {
        DescribeTargetHealthResponse response = call(reconciliation, "describing targets of " + targetGroupArn,
                () -> elbv2Client.describeTargetHealth(DescribeTargetHealthRequest.builder().targetGroupArn(targetGroupArn).build()),
                e -> new FetchFailureException(targetGroupArn, "Failed to describe targets of " + targetGroupArn, e));

        List<Target> targets = new ArrayList<>();
        for (TargetHealthDescription description : response.targetHealthDescriptions()) {
            if (description.targetHealth() != null && description.targetHealth().state() == TargetHealthStateEnum.DRAINING) {
                LOGGER.debugCr(reconciliation, "Ignoring draining target {}", description.target().id());
                continue;
            }

            TargetDescription target = description.target();
            targets.add(new Target(target.id(), target.port(), target.availabilityZone()));
        }

        return targets;
    }

    @Override
    public void deregisterTargets(Reconciliation reconciliation, String targetGroupArn, List<Target> targets) {
        call(reconciliation, "deregistering targets of " + targetGroupArn,
                () -> elbv2Client.deregisterTargets(DeregisterTargetsRequest.builder().targetGroupArn(targetGroupArn).targets(toTargetDescriptions(targets)).build()),
                e -> new RevokeFailureException(targetGroupArn, "Failed to deregister targets " + targets + " from " + targetGroupArn, e));

        LOGGER.infoCr(reconciliation, "Deregistered {} targets from {}", targets.size(), targetGroupArn);
    }

    @Override
    public void registerTargets(Reconciliation reconciliation, String targetGroupArn, List<Target> targets) {
        call(reconciliation, "registering targets of " + targetGroupArn,
                () -> elbv2Client.registerTargets(RegisterTargetsRequest.builder().targetGroupArn(targetGroupArn).targets(toTargetDescriptions(targets)).build()),
                e -> new GrantFailureException(targetGroupArn, "Failed to register targets " + targets + " in " + targetGroupArn, e));

        LOGGER.infoCr(reconciliation, "Registered {} targets in {}", targets.size(), targetGroupArn);
    }

    private static <T> T call(Reconciliation reconciliation, String operation, Supplier<T> call, Function<SdkException, RuntimeException> failure) {
        try {
            return call.get();
        } catch (AbortedException | ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            throw new ReconciliationCancelledException(reconciliation + " was cancelled while " + operation, e);
        } catch (SdkException e) {
            throw failure.apply(e);
        }
    }

    private static List<TargetDescription> toTargetDescriptions(List<Target> targets) {
        List<TargetDescription> descriptions = new ArrayList<>(targets.size());

        for (Target target : targets) {
            descriptions.add(TargetDescription.builder()
                    .id(target.id())
                    .port(target.port())
                    .availabilityZone(target.availabilityZone())
                    .build());
        }

        return descriptions;
    }
}
