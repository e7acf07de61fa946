/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.inventory.EcsTaskDefinition;
import com.google.common.base.Ticker;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TaskDefinitionCacheTest extends EasyMockSupport {
    private TaskDefinitionLoader loader;
    private EcsTaskDefinition taskDefinition;

    @BeforeEach
    public void setup() {
        loader = mock(TaskDefinitionLoader.class);
        taskDefinition = EcsTaskDefinition.builder().arn("td-1").family("app").build();
    }

    @Test
    public void get_loadsOnce() throws Exception {
        expect(loader.load("td-1")).andReturn(taskDefinition);
        replayAll();
        TaskDefinitionCache testClass = new TaskDefinitionCache(loader, 10);
        assertEquals(Optional.of(taskDefinition), testClass.get("td-1"));
        assertEquals(Optional.of(taskDefinition), testClass.get("td-1"));
        assertEquals(1L, testClass.stats().hitCount());
        assertEquals(1L, testClass.stats().missCount());
        verifyAll();
    }

    @Test
    public void get_failureNotCached() throws Exception {
        expect(loader.load("td-1")).andThrow(new RuntimeException("throttled"));
        expect(loader.load("td-1")).andReturn(taskDefinition);
        replayAll();
        TaskDefinitionCache testClass = new TaskDefinitionCache(loader, 10);
        assertEquals(Optional.empty(), testClass.get("td-1"));
        assertEquals(Optional.of(taskDefinition), testClass.get("td-1"));
        verifyAll();
    }

    @Test
    public void get_nullNotCached() throws Exception {
        expect(loader.load("td-1")).andReturn(null).times(2);
        replayAll();
        TaskDefinitionCache testClass = new TaskDefinitionCache(loader, 10);
        assertEquals(Optional.empty(), testClass.get("td-1"));
        assertEquals(Optional.empty(), testClass.get("td-1"));
        assertEquals(0L, testClass.size());
        verifyAll();
    }

    @Test
    public void get_nullArn() {
        replayAll();
        assertEquals(Optional.empty(), new TaskDefinitionCache(loader, 10).get(null));
        verifyAll();
    }

    @Test
    public void get_expiresAfterAccess() throws Exception {
        ManualTicker ticker = new ManualTicker();
        expect(loader.load("td-1")).andReturn(taskDefinition).times(2);
        replayAll();
        TaskDefinitionCache testClass = new TaskDefinitionCache(loader, 10, Duration.ofMinutes(10), ticker);
        testClass.get("td-1");
        ticker.advance(Duration.ofMinutes(5));
        testClass.get("td-1");
        ticker.advance(Duration.ofMinutes(9));
        testClass.get("td-1");
        ticker.advance(Duration.ofMinutes(11));
        testClass.get("td-1");
        verifyAll();
    }

    @Test
    public void get_evictsLeastRecentlyUsed() throws Exception {
        EcsTaskDefinition td2 = EcsTaskDefinition.builder().arn("td-2").build();
        expect(loader.load("td-1")).andReturn(taskDefinition);
        expect(loader.load("td-2")).andReturn(td2);
        replayAll();
        TaskDefinitionCache testClass = new TaskDefinitionCache(loader, 1);
        testClass.get("td-1");
        testClass.get("td-2");
        assertEquals(1L, testClass.size());
        assertEquals(1L, testClass.stats().evictionCount());
        verifyAll();
    }

    private static class ManualTicker extends Ticker {
        private long nanos;

        @Override
        public long read() {
            return nanos;
        }

        void advance(Duration duration) {
            nanos += TimeUnit.MILLISECONDS.toNanos(duration.toMillis());
        }
    }
}
