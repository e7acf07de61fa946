/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.resource;

import com.google.common.collect.ImmutableList;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static ai.asserts.ecs.resource.ResourceType.ECSCluster;
import static ai.asserts.ecs.resource.ResourceType.ECSContainer;
import static ai.asserts.ecs.resource.ResourceType.ECSService;
import static ai.asserts.ecs.resource.ResourceType.ECSTask;
import static ai.asserts.ecs.resource.ResourceType.ECSTaskDef;

/**
 * Parses ECS ARNs. Both the long ARN format, which names the cluster, and the older short format are understood.
 */
@Component
public class ResourceMapper {
    public static final Pattern ECS_CLUSTER_PATTERN = Pattern.compile("arn:[^:]+:ecs:(.+?):(.+?):cluster/(.+)");
    public static final Pattern ECS_SERVICE_PATTERN =
            Pattern.compile("arn:[^:]+:ecs:(.+?):(.+?):service/(?:(.+?)/)?(.+)");
    public static final Pattern ECS_TASK_DEFINITION_PATTERN =
            Pattern.compile("arn:[^:]+:ecs:(.+?):(.+?):task-definition/(.+)");
    public static final Pattern ECS_TASK_PATTERN = Pattern.compile("arn:[^:]+:ecs:(.+?):(.+?):task/(?:(.+?)/)?(.+)");
    public static final Pattern ECS_CONTAINER_PATTERN =
            Pattern.compile("arn:[^:]+:ecs:(.+?):(.+?):container/(?:(.+?)/(?:.+?)/)?(.+)");

    private final List<Function<String, Optional<Resource>>> mappers = new ImmutableList.Builder<Function<String,
            Optional<Resource>>>()
            .add(arn -> {
                if (arn.contains(":cluster/")) {
                    Matcher matcher = ECS_CLUSTER_PATTERN.matcher(arn);
                    if (matcher.matches()) {
                        return Optional.of(Resource.builder()
                                .type(ECSCluster)
                                .arn(arn)
                                .region(matcher.group(1))
                                .account(matcher.group(2))
                                .name(matcher.group(3))
                                .build());
                    }
                }
                return Optional.empty();
            })
            .add(arn -> {
                if (arn.contains(":service/")) {
                    Matcher matcher = ECS_SERVICE_PATTERN.matcher(arn);
                    if (matcher.matches()) {
                        return Optional.of(Resource.builder()
                                .type(ECSService)
                                .arn(arn)
                                .region(matcher.group(1))
                                .account(matcher.group(2))
                                .name(matcher.group(4))
                                .childOf(cluster(matcher))
                                .build());
                    }
                }
                return Optional.empty();
            })
            .add(arn -> {
                if (arn.contains(":task-definition/")) {
                    Matcher matcher = ECS_TASK_DEFINITION_PATTERN.matcher(arn);
                    if (matcher.matches()) {
                        String[] nameAndVersion = matcher.group(3).split(":");
                        return Optional.of(Resource.builder()
                                .type(ECSTaskDef)
                                .arn(arn)
                                .region(matcher.group(1))
                                .account(matcher.group(2))
                                .name(nameAndVersion[0])
                                .version(nameAndVersion.length == 2 ? nameAndVersion[1] : null)
                                .build());
                    }
                }
                return Optional.empty();
            })
            .add(arn -> {
                if (arn.contains(":task/")) {
                    Matcher matcher = ECS_TASK_PATTERN.matcher(arn);
                    if (matcher.matches()) {
                        return Optional.of(Resource.builder()
                                .type(ECSTask)
                                .arn(arn)
                                .region(matcher.group(1))
                                .account(matcher.group(2))
                                .name(matcher.group(4))
                                .childOf(cluster(matcher))
                                .build());
                    }
                }
                return Optional.empty();
            })
            .add(arn -> {
                if (arn.contains(":container/")) {
                    Matcher matcher = ECS_CONTAINER_PATTERN.matcher(arn);
                    if (matcher.matches()) {
                        return Optional.of(Resource.builder()
                                .type(ECSContainer)
                                .arn(arn)
                                .region(matcher.group(1))
                                .account(matcher.group(2))
                                .name(matcher.group(4))
                                .childOf(cluster(matcher))
                                .build());
                    }
                }
                return Optional.empty();
            })
            .build();

    public Optional<Resource> map(String arn) {
        if (arn == null || !arn.contains(":ecs:")) {
            return Optional.empty();
        }
        return mappers.stream()
                .map(mapper -> mapper.apply(arn))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private static Resource cluster(Matcher matcher) {
        if (matcher.group(3) == null) {
            return null;
        }
        return Resource.builder()
                .type(ECSCluster)
                .region(matcher.group(1))
                .account(matcher.group(2))
                .name(matcher.group(3))
                .build();
    }
}
