/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.MetricsProvider;
import io.lbcontroller.operator.networking.securitygroup.DefaultSecurityGroupReconciler;
import io.lbcontroller.operator.networking.securitygroup.Ec2SecurityGroupManager;
import io.lbcontroller.operator.networking.targetgroup.DefaultTargetGroupReconciler;
import io.lbcontroller.operator.networking.targetgroup.Elbv2TargetGroupManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;

/**
 * Wires the networking controllers together. The AWS clients and the sources of the desired state are created by the
 * caller.
 */
public class NetworkingOperator {
    private static final Logger LOGGER = LogManager.getLogger(NetworkingOperator.class);

    private final ControllerConfig config;
    private final ServiceController serviceController;
    private final TargetGroupBindingController targetGroupBindingController;

    /**
     * Constructor
     *
     * @param config                    Controller configuration
     * @param ec2Client                 Configured EC2 client
     * @param elbv2Client               Configured ELBv2 client
     * @param desiredIngressSource      Source of the desired security group rules
     * @param desiredTargetsSource      Source of the desired targets
     * @param metricsProvider           Metrics provider
     */
    public NetworkingOperator(ControllerConfig config, Ec2Client ec2Client, ElasticLoadBalancingV2Client elbv2Client,
                              DesiredIngressSource desiredIngressSource, DesiredTargetsSource desiredTargetsSource,
                              MetricsProvider metricsProvider) {
        this(config,
                new ServiceController(config, desiredIngressSource, new DefaultSecurityGroupReconciler(new Ec2SecurityGroupManager(ec2Client)), metricsProvider),
                new TargetGroupBindingController(config, desiredTargetsSource, new DefaultTargetGroupReconciler(new Elbv2TargetGroupManager(elbv2Client)), metricsProvider));
    }

    /* test */ NetworkingOperator(ControllerConfig config, ServiceController serviceController, TargetGroupBindingController targetGroupBindingController) {
        this.config = config;
        this.serviceController = serviceController;
        this.targetGroupBindingController = targetGroupBindingController;
    }

    /**
     * Starts the controllers
     */
    public void start() {
        LOGGER.info("Starting the networking controllers for cluster {} with configuration {}", config.getClusterName(), config);
        serviceController.start();
        targetGroupBindingController.start();
    }

    /**
     * Stops the controllers
     */
    public void stop() {
        LOGGER.info("Stopping the networking controllers");
        serviceController.stop();
        targetGroupBindingController.stop();
    }

    /**
     * @return  True when all controllers are alive
     */
    public boolean isAlive() {
        return serviceController.isAlive() && targetGroupBindingController.isAlive();
    }

    /**
     * @return  True when all controllers are ready
     */
    public boolean isReady() {
        return serviceController.isReady() && targetGroupBindingController.isReady();
    }

    /**
     * @return  The Service controller
     */
    public ServiceController serviceController() {
        return serviceController;
    }

    /**
     * @return  The TargetGroupBinding controller
     */
    public TargetGroupBindingController targetGroupBindingController() {
        return targetGroupBindingController;
    }
}
