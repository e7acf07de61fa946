/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import ai.asserts.ecs.resource.Resource;
import ai.asserts.ecs.resource.ResourceMapper;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ecs.model.Attachment;
import software.amazon.awssdk.services.ecs.model.Container;
import software.amazon.awssdk.services.ecs.model.ContainerDefinition;
import software.amazon.awssdk.services.ecs.model.KeyValuePair;
import software.amazon.awssdk.services.ecs.model.Service;
import software.amazon.awssdk.services.ecs.model.Tag;
import software.amazon.awssdk.services.ecs.model.Task;
import software.amazon.awssdk.services.ecs.model.TaskDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps AWS SDK ECS model objects to inventory records.
 */
@Component
@AllArgsConstructor
public class EcsModelMapper {
    public static final String ENI_ATTACHMENT = "ElasticNetworkInterface";
    public static final String ENI_PRIVATE_IP = "privateIPv4Address";
    public static final String SERVICE_GROUP_PREFIX = "service:";

    private final ResourceMapper resourceMapper;

    public EcsService toService(Service service) {
        return EcsService.builder()
                .arn(service.serviceArn())
                .name(service.serviceName())
                .clusterArn(service.clusterArn())
                .tags(service.hasTags() ? toMap(service.tags()) : new LinkedHashMap<>())
                .build();
    }

    /**
     * @param hostAddress  private IP of the container instance, <code>null</code> for Fargate tasks.
     * @param ec2InstanceId id of the EC2 instance behind the container instance, if known.
     */
    public EcsTask toTask(Task task, String hostAddress, String ec2InstanceId) {
        Optional<String> eniAddress = getENIAddress(task);
        return EcsTask.builder()
                .arn(task.taskArn())
                .taskId(resourceMapper.map(task.taskArn()).map(Resource::getName).orElse(task.taskArn()))
                .clusterArn(task.clusterArn())
                .serviceName(getServiceName(task).orElse(null))
                .taskDefinitionArn(task.taskDefinitionArn())
                .launchType(LaunchType.fromValue(task.launchTypeAsString()))
                .lastStatus(task.lastStatus())
                // DescribeTasks does not report the network mode, an attached ENI implies awsvpc
                .networkMode(eniAddress.isPresent() ? NetworkMode.AWSVPC : null)
                .eniAddress(eniAddress.orElse(null))
                .hostAddress(hostAddress)
                .ec2InstanceId(ec2InstanceId)
                .availabilityZone(task.availabilityZone())
                .tags(task.hasTags() ? toMap(task.tags()) : new LinkedHashMap<>())
                .containers(task.hasContainers() ?
                        task.containers().stream().map(this::toContainer).collect(Collectors.toList()) :
                        new ArrayList<>())
                .build();
    }

    public EcsContainer toContainer(Container container) {
        String containerId = container.runtimeId();
        if (containerId == null && container.containerArn() != null) {
            containerId = resourceMapper.map(container.containerArn()).map(Resource::getName).orElse(null);
        }
        return EcsContainer.builder()
                .name(container.name())
                .arn(container.containerArn())
                .containerId(containerId)
                .networkBindings(container.hasNetworkBindings() ?
                        container.networkBindings().stream()
                                .map(binding -> EcsNetworkBinding.builder()
                                        .containerPort(binding.containerPort())
                                        .hostPort(binding.hostPort())
                                        .bindIP(binding.bindIP())
                                        .build())
                                .collect(Collectors.toList()) :
                        new ArrayList<>())
                .build();
    }

    public EcsTaskDefinition toTaskDefinition(TaskDefinition taskDefinition, List<Tag> tags) {
        return EcsTaskDefinition.builder()
                .arn(taskDefinition.taskDefinitionArn())
                .family(taskDefinition.family())
                .revision(taskDefinition.revision())
                .networkMode(NetworkMode.fromValue(taskDefinition.networkModeAsString()).orElse(null))
                .containerDefinitions(taskDefinition.hasContainerDefinitions() ?
                        taskDefinition.containerDefinitions().stream()
                                .map(this::toContainerDefinition)
                                .collect(Collectors.toList()) :
                        new ArrayList<>())
                .tags(tags != null ? toMap(tags) : new LinkedHashMap<>())
                .build();
    }

    public EcsContainerDefinition toContainerDefinition(ContainerDefinition containerDefinition) {
        Map<String, String> environment = new LinkedHashMap<>();
        if (containerDefinition.hasEnvironment()) {
            containerDefinition.environment().stream()
                    .filter(kv -> kv.name() != null && kv.value() != null)
                    .forEach(kv -> environment.put(kv.name(), kv.value()));
        }
        return EcsContainerDefinition.builder()
                .name(containerDefinition.name())
                .portMappings(containerDefinition.hasPortMappings() ?
                        containerDefinition.portMappings().stream()
                                .map(mapping -> EcsPortMapping.builder()
                                        .containerPort(mapping.containerPort())
                                        .hostPort(mapping.hostPort())
                                        .build())
                                .collect(Collectors.toList()) :
                        new ArrayList<>())
                .environment(environment)
                .build();
    }

    public Optional<String> getServiceName(Task task) {
        return task.group() != null && task.group().startsWith(SERVICE_GROUP_PREFIX) ?
                Optional.of(task.group().substring(SERVICE_GROUP_PREFIX.length())) : Optional.empty();
    }

    public Optional<String> getENIAddress(Task task) {
        if (!task.hasAttachments()) {
            return Optional.empty();
        }
        return task.attachments().stream()
                .filter(attachment -> ENI_ATTACHMENT.equals(attachment.type()))
                .filter(Attachment::hasDetails)
                .flatMap(attachment -> attachment.details().stream())
                .filter(detail -> ENI_PRIVATE_IP.equals(detail.name()))
                .map(KeyValuePair::value)
                .filter(value -> value != null && !value.isEmpty())
                .findFirst();
    }

    private Map<String, String> toMap(List<Tag> tags) {
        Map<String, String> map = new LinkedHashMap<>();
        tags.stream()
                .filter(tag -> tag.key() != null)
                .forEach(tag -> map.put(tag.key(), tag.value()));
        return map;
    }
}
