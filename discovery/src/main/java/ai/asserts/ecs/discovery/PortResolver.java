/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.inventory.EcsContainer;
import ai.asserts.ecs.inventory.EcsContainerDefinition;
import ai.asserts.ecs.inventory.EcsNetworkBinding;
import ai.asserts.ecs.inventory.EcsPortMapping;
import ai.asserts.ecs.inventory.EcsTask;
import ai.asserts.ecs.inventory.EcsTaskDefinition;
import ai.asserts.ecs.inventory.NetworkMode;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.Optional;

import static ai.asserts.ecs.discovery.FailureReason.INVALID_PORT_OVERRIDE;
import static ai.asserts.ecs.discovery.FailureReason.NO_ADDRESS;
import static ai.asserts.ecs.discovery.FailureReason.NO_DECLARED_PORT;
import static ai.asserts.ecs.discovery.FailureReason.NO_MATCHING_BINDING;
import static ai.asserts.ecs.discovery.FailureReason.NO_NETWORK_BINDINGS;
import static ai.asserts.ecs.discovery.FailureReason.UNSUPPORTED_NETWORK_MODE;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS_CONTAINER_PORT;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS_PORT;
import static java.lang.String.format;
import static org.springframework.util.StringUtils.hasText;

/**
 * Works out the host and port Prometheus should scrape for a container.
 * <ul>
 *     <li><code>awsvpc</code>: the task's network interface IP and the first declared container port</li>
 *     <li><code>host</code>: the container instance IP and the first declared container port</li>
 *     <li><code>bridge</code>: the container instance IP and the host port Docker actually bound</li>
 *     <li>Fargate: the task's network interface IP and port 80</li>
 * </ul>
 * <code>PROMETHEUS_PORT</code> replaces the port in every mode. <code>PROMETHEUS_CONTAINER_PORT</code> is used as is
 * where the container port is reachable directly and selects the runtime binding in <code>bridge</code> mode.
 */
@Component
@Slf4j
public class PortResolver {
    public static final int DEFAULT_SERVERLESS_PORT = 80;

    public ResolvedPort resolve(EcsTask task, EcsTaskDefinition taskDefinition,
                                EcsContainerDefinition containerDefinition,
                                EcsContainer container) throws PortResolutionException {
        NetworkMode networkMode = getNetworkMode(task, taskDefinition);
        Optional<Integer> portOverride = getPortOverride(containerDefinition, PROMETHEUS_PORT);
        Optional<Integer> containerPortOverride = getPortOverride(containerDefinition, PROMETHEUS_CONTAINER_PORT);

        String host = getHost(task, networkMode, containerDefinition);
        int port;
        if (portOverride.isPresent()) {
            port = portOverride.get();
        } else if (task.getLaunchType().isServerless()) {
            port = containerPortOverride.orElse(DEFAULT_SERVERLESS_PORT);
        } else if (networkMode == NetworkMode.BRIDGE) {
            port = getBoundHostPort(containerDefinition, container, containerPortOverride);
        } else {
            port = containerPortOverride.isPresent() ? containerPortOverride.get() :
                    getFirstDeclaredPort(containerDefinition);
        }

        ResolvedPort resolvedPort = ResolvedPort.builder()
                .host(host)
                .port(port)
                .networkMode(networkMode)
                .build();
        log.debug("Resolved {} for container {} of task {}", resolvedPort.getAddress(),
                containerDefinition.getName(), task.getArn());
        return resolvedPort;
    }

    /**
     * The task definition's network mode is authoritative. Task definitions without one default to
     * <code>bridge</code>, except on Fargate where only <code>awsvpc</code> is possible.
     */
    public NetworkMode getNetworkMode(EcsTask task, EcsTaskDefinition taskDefinition) {
        if (taskDefinition != null && taskDefinition.getNetworkMode() != null) {
            return taskDefinition.getNetworkMode();
        }
        if (task.getNetworkMode() != null) {
            return task.getNetworkMode();
        }
        return task.getLaunchType().isServerless() ? NetworkMode.AWSVPC : NetworkMode.BRIDGE;
    }

    @VisibleForTesting
    String getHost(EcsTask task, NetworkMode networkMode, EcsContainerDefinition containerDefinition)
            throws PortResolutionException {
        String host;
        if (task.getLaunchType().isServerless() || networkMode == NetworkMode.AWSVPC) {
            host = task.getEniAddress();
        } else if (networkMode == NetworkMode.HOST || networkMode == NetworkMode.BRIDGE) {
            host = task.getHostAddress();
        } else {
            throw new PortResolutionException(UNSUPPORTED_NETWORK_MODE,
                    format("Network mode %s of container %s has no reachable address", networkMode.getValue(),
                            containerDefinition.getName()));
        }
        if (!hasText(host)) {
            throw new PortResolutionException(NO_ADDRESS,
                    format("No %s address known for container %s",
                            networkMode == NetworkMode.AWSVPC ? "network interface" : "container instance",
                            containerDefinition.getName()));
        }
        return host;
    }

    @VisibleForTesting
    int getBoundHostPort(EcsContainerDefinition containerDefinition, EcsContainer container,
                         Optional<Integer> containerPortOverride) throws PortResolutionException {
        if (containerPortOverride.isPresent()) {
            int containerPort = containerPortOverride.get();
            return container.getNetworkBindings().stream()
                    .filter(binding -> binding.getContainerPort() != null &&
                            binding.getContainerPort() == containerPort && binding.getHostPort() != null)
                    .map(EcsNetworkBinding::getHostPort)
                    .findFirst()
                    .orElseThrow(() -> new PortResolutionException(NO_MATCHING_BINDING,
                            format("%s=%d has no matching network binding in container %s",
                                    PROMETHEUS_CONTAINER_PORT, containerPort, containerDefinition.getName())));
        }
        if (CollectionUtils.isEmpty(container.getNetworkBindings()) ||
                container.getNetworkBindings().get(0).getHostPort() == null) {
            throw new PortResolutionException(NO_NETWORK_BINDINGS,
                    format("Container %s does not have a network binding", containerDefinition.getName()));
        }
        return container.getNetworkBindings().get(0).getHostPort();
    }

    @VisibleForTesting
    int getFirstDeclaredPort(EcsContainerDefinition containerDefinition) throws PortResolutionException {
        return containerDefinition.getPortMappings().stream()
                .map(EcsPortMapping::getContainerPort)
                .filter(port -> port != null && port > 0)
                .findFirst()
                .orElseThrow(() -> new PortResolutionException(NO_DECLARED_PORT,
                        format("Container %s does not declare a port", containerDefinition.getName())));
    }

    @VisibleForTesting
    Optional<Integer> getPortOverride(EcsContainerDefinition containerDefinition, String variable)
            throws PortResolutionException {
        Optional<String> value = containerDefinition.getEnvironmentVariable(variable);
        if (value.isEmpty() || !hasText(value.get())) {
            return Optional.empty();
        }
        try {
            int port = Integer.parseInt(value.get().trim());
            if (port > 0 && port <= 65535) {
                return Optional.of(port);
            }
        } catch (NumberFormatException e) {
            log.debug("{} is not a number", variable, e);
        }
        throw new PortResolutionException(INVALID_PORT_OVERRIDE,
                format("%s=%s of container %s is not a valid port", variable, value.get(),
                        containerDefinition.getName()));
    }
}
