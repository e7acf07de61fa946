/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import ai.asserts.ecs.AWSApiCallRateLimiter;
import ai.asserts.ecs.AWSClientProvider;
import ai.asserts.ecs.resource.ResourceMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.DescribeTaskDefinitionRequest;
import software.amazon.awssdk.services.ecs.model.DescribeTaskDefinitionResponse;
import software.amazon.awssdk.services.ecs.model.Tag;
import software.amazon.awssdk.services.ecs.model.TaskDefinition;
import software.amazon.awssdk.services.ecs.model.TaskDefinitionField;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EcsTaskDefinitionLoaderTest extends EasyMockSupport {
    private AWSClientProvider awsClientProvider;
    private EcsClient ecsClient;
    private EcsTaskDefinitionLoader testClass;

    @BeforeEach
    public void setup() {
        awsClientProvider = mock(AWSClientProvider.class);
        ecsClient = mock(EcsClient.class);
        testClass = new EcsTaskDefinitionLoader(awsClientProvider,
                new AWSApiCallRateLimiter(new SimpleMeterRegistry(), 100),
                new EcsModelMapper(new ResourceMapper()));
        expect(awsClientProvider.getEcsClient()).andReturn(ecsClient);
        expect(awsClientProvider.getRegion()).andReturn("us-west-2").anyTimes();
    }

    @Test
    public void load() {
        expect(ecsClient.describeTaskDefinition(request())).andReturn(DescribeTaskDefinitionResponse.builder()
                .taskDefinition(TaskDefinition.builder()
                        .taskDefinitionArn("td-arn")
                        .family("web")
                        .revision(3)
                        .build())
                .tags(Tag.builder().key("team").value("platform").build())
                .build());
        replayAll();
        EcsTaskDefinition taskDefinition = testClass.load("td-arn");
        assertEquals("web", taskDefinition.getFamily());
        assertEquals("platform", taskDefinition.getTags().get("team"));
        verifyAll();
    }

    @Test
    public void load_notFound() {
        expect(ecsClient.describeTaskDefinition(request()))
                .andReturn(DescribeTaskDefinitionResponse.builder().build());
        replayAll();
        assertNull(testClass.load("td-arn"));
        verifyAll();
    }

    @Test
    public void load_apiError() {
        expect(ecsClient.describeTaskDefinition(request())).andThrow(new IllegalStateException("throttled"));
        replayAll();
        assertThrows(RuntimeException.class, () -> testClass.load("td-arn"));
        verifyAll();
    }

    private DescribeTaskDefinitionRequest request() {
        return DescribeTaskDefinitionRequest.builder()
                .taskDefinition("td-arn")
                .include(TaskDefinitionField.TAGS)
                .build();
    }
}
