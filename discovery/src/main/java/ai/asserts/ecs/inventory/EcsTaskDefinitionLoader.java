/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import ai.asserts.ecs.AWSApiCallRateLimiter;
import ai.asserts.ecs.AWSClientProvider;
import ai.asserts.ecs.discovery.TaskDefinitionLoader;
import com.google.common.collect.ImmutableSortedMap;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.DescribeTaskDefinitionRequest;
import software.amazon.awssdk.services.ecs.model.DescribeTaskDefinitionResponse;
import software.amazon.awssdk.services.ecs.model.TaskDefinitionField;

import static ai.asserts.ecs.AWSApiCallRateLimiter.OPERATION_LABEL;
import static ai.asserts.ecs.AWSApiCallRateLimiter.REGION_LABEL;

@Component
@Slf4j
@AllArgsConstructor
public class EcsTaskDefinitionLoader implements TaskDefinitionLoader {
    private final AWSClientProvider awsClientProvider;
    private final AWSApiCallRateLimiter rateLimiter;
    private final EcsModelMapper modelMapper;

    @Override
    public EcsTaskDefinition load(String taskDefinitionArn) {
        EcsClient ecsClient = awsClientProvider.getEcsClient();
        String operationName = "EcsClient/describeTaskDefinition";
        DescribeTaskDefinitionRequest request = DescribeTaskDefinitionRequest.builder()
                .taskDefinition(taskDefinitionArn)
                .include(TaskDefinitionField.TAGS)
                .build();
        DescribeTaskDefinitionResponse response = rateLimiter.doWithRateLimit(operationName,
                ImmutableSortedMap.of(
                        REGION_LABEL, awsClientProvider.getRegion(),
                        OPERATION_LABEL, operationName),
                () -> ecsClient.describeTaskDefinition(request));
        if (response.taskDefinition() == null) {
            return null;
        }
        log.debug("Loaded task definition {}", taskDefinitionArn);
        return modelMapper.toTaskDefinition(response.taskDefinition(), response.hasTags() ? response.tags() : null);
    }
}
