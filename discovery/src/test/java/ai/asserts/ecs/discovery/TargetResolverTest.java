/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.LabelNameUtil;
import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.config.TagExportConfig;
import ai.asserts.ecs.inventory.EcsCluster;
import ai.asserts.ecs.inventory.EcsContainer;
import ai.asserts.ecs.inventory.EcsContainerDefinition;
import ai.asserts.ecs.inventory.EcsNetworkBinding;
import ai.asserts.ecs.inventory.EcsPortMapping;
import ai.asserts.ecs.inventory.EcsService;
import ai.asserts.ecs.inventory.EcsTask;
import ai.asserts.ecs.inventory.EcsTaskDefinition;
import ai.asserts.ecs.inventory.InventorySnapshot;
import ai.asserts.ecs.inventory.NetworkMode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS_CONTAINER_PORT;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS_ENDPOINT;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS_NOLABELS;
import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TargetResolverTest extends EasyMockSupport {
    private TaskDefinitionLoader loader;
    private TaskDefinitionCache cache;
    private DiscoveryConfig discoveryConfig;
    private TargetResolver testClass;

    @BeforeEach
    public void setup() {
        loader = mock(TaskDefinitionLoader.class);
        cache = new TaskDefinitionCache(loader, 100);
        discoveryConfig = new DiscoveryConfig();
        testClass = new TargetResolver(new PortResolver(), new LabelBuilder(new LabelNameUtil()),
                new IntervalBucketer());
    }

    @Test
    public void resolve_bridgeTaskWithTwoEndpoints() throws Exception {
        expect(loader.load("td-web")).andReturn(taskDefinition("td-web", "web", NetworkMode.BRIDGE,
                containerDefinition("app", ImmutableMap.of(
                        PROMETHEUS, "true",
                        PROMETHEUS_ENDPOINT, "30s:/mymetrics1,/mymetrics2",
                        PROMETHEUS_CONTAINER_PORT, "8080"), 8080),
                containerDefinition("sidecar", ImmutableMap.of(), 9000)));
        replayAll();

        EcsTask task = EcsTask.builder()
                .arn("task-1")
                .taskId("t1")
                .taskDefinitionArn("td-web")
                .serviceName("web-svc")
                .hostAddress("10.0.0.7")
                .containers(ImmutableList.of(
                        container("app", 8080, 32768),
                        container("sidecar", 9000, 32769)))
                .build();
        DiscoveryResult result = testClass.resolve(snapshot(cluster("prod", task)), discoveryConfig, cache);

        assertAll(
                () -> assertEquals(2, result.getTargetCount()),
                () -> assertEquals(0, result.getFailures().size()),
                () -> assertEquals(1, result.getTargets("30s").size()),
                () -> assertEquals(1, result.getTargets("default").size())
        );
        ScrapeTarget fast = result.getTargets("30s").get(0);
        assertAll(
                () -> assertEquals("10.0.0.7:32768", fast.getAddress()),
                () -> assertEquals("/mymetrics1", fast.getMetricsPath()),
                () -> assertEquals("/mymetrics1", fast.getLabels().get(Labels.METRICS_PATH)),
                () -> assertEquals("web", fast.getLabels().get(Labels.JOB)),
                () -> assertEquals("32768", fast.getLabels().get(Labels.PORT)),
                () -> assertEquals("web-svc", fast.getLabels().get(Labels.SERVICE)),
                () -> assertEquals("prod", fast.getLabels().get(Labels.CLUSTER)),
                () -> assertEquals("task-1", fast.getTaskArn()),
                () -> assertEquals("app", fast.getContainerName())
        );
        assertEquals("/mymetrics2", result.getTargets("default").get(0).getMetricsPath());
        verifyAll();
    }

    @Test
    public void resolve_defaultBucketDistinctFromOneMinute() throws Exception {
        expect(loader.load("td-web")).andReturn(taskDefinition("td-web", "web", NetworkMode.BRIDGE,
                containerDefinition("app", ImmutableMap.of(
                        PROMETHEUS, "true",
                        PROMETHEUS_ENDPOINT, "/a,1m:/b"), 8080)));
        replayAll();

        EcsTask task = EcsTask.builder()
                .arn("task-1")
                .taskDefinitionArn("td-web")
                .hostAddress("10.0.0.7")
                .containers(ImmutableList.of(container("app", 8080, 32768)))
                .build();
        DiscoveryResult result = testClass.resolve(snapshot(cluster("prod", task)), discoveryConfig, cache);

        assertAll(
                () -> assertEquals(1, result.getTargets("default").size()),
                () -> assertEquals("/a", result.getTargets("default").get(0).getMetricsPath()),
                () -> assertEquals(1, result.getTargets("1m").size()),
                () -> assertEquals("/b", result.getTargets("1m").get(0).getMetricsPath()),
                () -> assertEquals(result.getTargets("default").get(0).getInterval(),
                        result.getTargets("1m").get(0).getInterval())
        );
        verifyAll();
    }

    @Test
    public void resolve_awsvpcWithTagOverride() throws Exception {
        TagExportConfig tagExportConfig = new TagExportConfig();
        tagExportConfig.setIncludeTags(ImmutableSet.of("team"));
        discoveryConfig.setTagExportConfig(tagExportConfig);
        discoveryConfig.validateConfig();

        EcsTaskDefinition taskDefinition = EcsTaskDefinition.builder()
                .arn("td-api")
                .family("api")
                .revision(2)
                .networkMode(NetworkMode.AWSVPC)
                .containerDefinitions(ImmutableList.of(
                        containerDefinition("api", ImmutableMap.of(PROMETHEUS, "TRUE"), 9100)))
                .tags(ImmutableMap.of("team", "platform"))
                .build();
        expect(loader.load("td-api")).andReturn(taskDefinition);
        replayAll();

        EcsTask task = EcsTask.builder()
                .arn("task-2")
                .taskDefinitionArn("td-api")
                .eniAddress("10.0.1.5")
                .tags(ImmutableMap.of("team", "checkout"))
                .build();
        DiscoveryResult result = testClass.resolve(snapshot(cluster("prod", task)), discoveryConfig, cache);

        assertEquals(1, result.getTargetCount());
        ScrapeTarget target = result.getTargets("default").get(0);
        assertAll(
                () -> assertEquals("10.0.1.5:9100", target.getAddress()),
                () -> assertEquals("checkout", target.getLabels().get("tag_team")),
                () -> assertEquals("awsvpc", target.getLabels().get(Labels.NETWORK_MODE))
        );
        verifyAll();
    }

    @Test
    public void resolve_noLabels() throws Exception {
        TagExportConfig tagExportConfig = new TagExportConfig();
        tagExportConfig.setIncludeTags(ImmutableSet.of("*"));
        discoveryConfig.setTagExportConfig(tagExportConfig);
        discoveryConfig.validateConfig();

        expect(loader.load("td-web")).andReturn(taskDefinition("td-web", "web", NetworkMode.HOST,
                containerDefinition("app", ImmutableMap.of(PROMETHEUS, "true", PROMETHEUS_NOLABELS, "true"), 8080)));
        replayAll();

        EcsTask task = EcsTask.builder()
                .arn("task-1")
                .taskDefinitionArn("td-web")
                .hostAddress("10.0.0.7")
                .tags(ImmutableMap.of("team", "checkout"))
                .build();
        DiscoveryResult result = testClass.resolve(snapshot(cluster("prod", task)), discoveryConfig, cache);

        ScrapeTarget target = result.getTargets("default").get(0);
        assertEquals("10.0.0.7:8080", target.getAddress());
        assertEquals(ImmutableMap.of(
                Labels.JOB, "web",
                Labels.METRICS_PATH, "/metrics",
                Labels.INSTANCE, "web",
                Labels.PORT, "8080"), ImmutableMap.copyOf(target.getLabels()));
        verifyAll();
    }

    @Test
    public void resolve_notEnabled() throws Exception {
        expect(loader.load("td-web")).andReturn(taskDefinition("td-web", "web", NetworkMode.BRIDGE,
                containerDefinition("app", ImmutableMap.of(PROMETHEUS, "false"), 8080),
                containerDefinition("sidecar", ImmutableMap.of(), 9000)));
        replayAll();

        EcsTask task = EcsTask.builder()
                .arn("task-1")
                .taskDefinitionArn("td-web")
                .hostAddress("10.0.0.7")
                .containers(ImmutableList.of(container("app", 8080, 32768)))
                .build();
        DiscoveryResult result = testClass.resolve(snapshot(cluster("prod", task)), discoveryConfig, cache);

        assertEquals(0, result.getTargetCount());
        assertTrue(result.getFailures().isEmpty());
        verifyAll();
    }

    @Test
    public void resolve_failureDoesNotAbortCycle() throws Exception {
        expect(loader.load("td-web")).andReturn(taskDefinition("td-web", "web", NetworkMode.BRIDGE,
                containerDefinition("app", ImmutableMap.of(PROMETHEUS, "true"), 8080)));
        expect(loader.load("td-missing")).andThrow(new RuntimeException("AccessDenied"));
        replayAll();

        EcsTask unbound = EcsTask.builder()
                .arn("task-1")
                .taskDefinitionArn("td-web")
                .hostAddress("10.0.0.7")
                .build();
        EcsTask bound = EcsTask.builder()
                .arn("task-2")
                .taskDefinitionArn("td-web")
                .hostAddress("10.0.0.8")
                .containers(ImmutableList.of(container("app", 8080, 32768)))
                .build();
        EcsTask orphan = EcsTask.builder()
                .arn("task-3")
                .taskDefinitionArn("td-missing")
                .build();
        DiscoveryResult result = testClass.resolve(snapshot(cluster("prod", unbound, bound, orphan)),
                discoveryConfig, cache);

        assertEquals(1, result.getTargetCount());
        assertEquals("10.0.0.8:32768", result.getTargets("default").get(0).getAddress());
        assertEquals(ImmutableList.of(
                ResolutionFailure.builder()
                        .clusterArn("arn:aws:ecs:us-west-2:123456789012:cluster/prod")
                        .taskArn("task-1")
                        .containerName("app")
                        .reason(FailureReason.NO_NETWORK_BINDINGS)
                        .message("Container app does not have a network binding")
                        .build(),
                ResolutionFailure.builder()
                        .clusterArn("arn:aws:ecs:us-west-2:123456789012:cluster/prod")
                        .taskArn("task-3")
                        .reason(FailureReason.TASK_DEFINITION_UNAVAILABLE)
                        .message("Task definition td-missing is not available")
                        .build()
        ), result.getFailures());
        verifyAll();
    }

    @Test
    public void resolve_skipsStoppedTasksAndFilteredClusters() throws Exception {
        discoveryConfig.setClusters(ImmutableSet.of("prod"));
        expect(loader.load("td-web")).andReturn(taskDefinition("td-web", "web", NetworkMode.HOST,
                containerDefinition("app", ImmutableMap.of(PROMETHEUS, "true"), 8080)));
        replayAll();

        EcsTask running = EcsTask.builder()
                .arn("task-1")
                .taskDefinitionArn("td-web")
                .lastStatus("RUNNING")
                .hostAddress("10.0.0.7")
                .build();
        EcsTask stopped = EcsTask.builder()
                .arn("task-2")
                .taskDefinitionArn("td-web")
                .lastStatus("STOPPED")
                .hostAddress("10.0.0.8")
                .build();
        EcsTask other = EcsTask.builder()
                .arn("task-3")
                .taskDefinitionArn("td-web")
                .hostAddress("10.0.0.9")
                .build();
        InventorySnapshot snapshot = InventorySnapshot.builder()
                .clusters(ImmutableList.of(cluster("prod", running, stopped), cluster("staging", other)))
                .build();
        DiscoveryResult result = testClass.resolve(snapshot, discoveryConfig, cache);

        assertEquals(ImmutableList.of("10.0.0.7:8080"), result.getAllTargets().stream()
                .map(ScrapeTarget::getAddress)
                .collect(Collectors.toList()));
        verifyAll();
    }

    @Test
    public void resolve_taskDefinitionLoadedOncePerArn() throws Exception {
        expect(loader.load("td-web")).andReturn(taskDefinition("td-web", "web", NetworkMode.HOST,
                containerDefinition("app", ImmutableMap.of(PROMETHEUS, "true"), 8080))).once();
        replayAll();

        List<EcsTask> tasks = ImmutableList.of(
                EcsTask.builder().arn("task-1").taskDefinitionArn("td-web").hostAddress("10.0.0.7").build(),
                EcsTask.builder().arn("task-2").taskDefinitionArn("td-web").hostAddress("10.0.0.8").build());
        EcsCluster cluster = EcsCluster.builder()
                .arn("cluster-arn")
                .name("prod")
                .tasks(tasks)
                .build();
        testClass.resolve(snapshot(cluster), discoveryConfig, cache);
        DiscoveryResult result = testClass.resolve(snapshot(cluster), discoveryConfig, cache);
        assertEquals(2, result.getTargetCount());
        verifyAll();
    }

    @Test
    public void resolve_emptySnapshot() {
        replayAll();
        for (InventorySnapshot snapshot : new InventorySnapshot[]{null, InventorySnapshot.empty()}) {
            DiscoveryResult result = testClass.resolve(snapshot, discoveryConfig, cache);
            Set<String> buckets = result.getBuckets().keySet();
            assertEquals(ImmutableSet.of("15s", "30s", "1m", "5m", "default"), buckets);
            assertEquals(0, result.getTargetCount());
        }
        verifyAll();
    }

    @Test
    public void getContainers_virtualContainerWhenNoneReported() {
        EcsContainerDefinition definition = containerDefinition("app", ImmutableMap.of(), 8080);
        List<EcsContainer> containers = testClass.getContainers(EcsTask.builder().build(), definition);
        assertEquals(1, containers.size());
        assertEquals("app", containers.get(0).getName());
        assertTrue(containers.get(0).getNetworkBindings().isEmpty());
    }

    private InventorySnapshot snapshot(EcsCluster cluster) {
        return InventorySnapshot.builder()
                .clusters(ImmutableList.of(cluster))
                .build();
    }

    private EcsCluster cluster(String name, EcsTask... tasks) {
        return EcsCluster.builder()
                .arn("arn:aws:ecs:us-west-2:123456789012:cluster/" + name)
                .name(name)
                .services(ImmutableList.of(EcsService.builder().name("web-svc").build()))
                .tasks(ImmutableList.copyOf(tasks))
                .build();
    }

    private EcsTaskDefinition taskDefinition(String arn, String family, NetworkMode networkMode,
                                             EcsContainerDefinition... containerDefinitions) {
        return EcsTaskDefinition.builder()
                .arn(arn)
                .family(family)
                .revision(1)
                .networkMode(networkMode)
                .containerDefinitions(ImmutableList.copyOf(containerDefinitions))
                .build();
    }

    private EcsContainerDefinition containerDefinition(String name, ImmutableMap<String, String> environment,
                                                       int port) {
        return EcsContainerDefinition.builder()
                .name(name)
                .environment(environment)
                .portMappings(ImmutableList.of(EcsPortMapping.builder().containerPort(port).build()))
                .build();
    }

    private EcsContainer container(String name, int containerPort, int hostPort) {
        return EcsContainer.builder()
                .name(name)
                .networkBindings(ImmutableList.of(EcsNetworkBinding.builder()
                        .containerPort(containerPort)
                        .hostPort(hostPort)
                        .build()))
                .build();
    }
}
