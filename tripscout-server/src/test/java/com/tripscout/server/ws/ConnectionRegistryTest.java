package com.tripscout.server.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripscout.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

/**
 * ConnectionRegistry 单元测试：
 * - 按范围投递，失败的连接被移除但不影响其它连接；
 * - 任务订阅切换、断开、心跳清理与全部关闭；
 * - 每条消息都带 timestamp。
 */
@ExtendWith(MockitoExtension.class)
class ConnectionRegistryTest {

    @Mock
    private MetricsRecorder metricsRecorder;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(objectMapper, metricsRecorder);
    }

    @Test
    void publish_shouldDeliverOnlyToSubscribersOfThatJob() throws Exception {
        FakeEventConnection a = new FakeEventConnection("a");
        FakeEventConnection b = new FakeEventConnection("b");
        registry.subscribe(a, SubscriptionScope.JOB, "job-1");
        registry.subscribe(b, SubscriptionScope.JOB, "job-2");

        int delivered = registry.publish(SubscriptionScope.JOB, "job-1", event("progress"));

        assertEquals(1, delivered);
        assertEquals(1, a.sent.size());
        assertTrue(b.sent.isEmpty());
        JsonNode json = objectMapper.readTree(a.sent.get(0));
        assertEquals("progress", json.get("type").asText());
        assertTrue(json.hasNonNull("timestamp"));
    }

    @Test
    void publish_shouldDropFailingConnectionAndKeepOthers() {
        FakeEventConnection healthy = new FakeEventConnection("healthy");
        FakeEventConnection broken = new FakeEventConnection("broken");
        broken.failOnSend = true;
        registry.subscribe(broken, SubscriptionScope.JOB, "job-1");
        registry.subscribe(healthy, SubscriptionScope.JOB, "job-1");

        int delivered = registry.publish(SubscriptionScope.JOB, "job-1", event("progress"));

        assertEquals(1, delivered);
        assertEquals(1, healthy.sent.size());
        assertEquals(1, registry.subscriberCount(SubscriptionScope.JOB, "job-1"));
        verify(metricsRecorder).recordEventDeliveryFailure("job");
    }

    @Test
    void publish_shouldReturnZero_whenNobodySubscribed() {
        assertEquals(0, registry.publish(SubscriptionScope.USER, "nobody", event("job_finished")));
    }

    @Test
    void resubscribeJob_shouldMoveConnectionBetweenJobs() {
        FakeEventConnection c = new FakeEventConnection("c");
        registry.subscribe(c, SubscriptionScope.JOB, "job-old");

        registry.resubscribeJob(c, "job-old", "job-new");

        assertEquals(0, registry.subscriberCount(SubscriptionScope.JOB, "job-old"));
        assertEquals(1, registry.subscriberCount(SubscriptionScope.JOB, "job-new"));
        registry.publish(SubscriptionScope.JOB, "job-old", event("progress"));
        assertTrue(c.sent.isEmpty());
        registry.publish(SubscriptionScope.JOB, "job-new", event("progress"));
        assertEquals(1, c.sent.size());
    }

    @Test
    void disconnect_shouldRemoveFromEveryScope() {
        FakeEventConnection c = new FakeEventConnection("c");
        registry.subscribe(c, SubscriptionScope.JOB, "job-1");
        registry.subscribe(c, SubscriptionScope.USER, "user-1");
        registry.subscribe(c, SubscriptionScope.GLOBAL, null);

        registry.disconnect(c);

        assertEquals(0, registry.subscriberCount(SubscriptionScope.JOB, "job-1"));
        assertEquals(0, registry.subscriberCount(SubscriptionScope.USER, "user-1"));
        assertEquals(0, registry.subscriberCount(SubscriptionScope.GLOBAL, null));
        assertEquals(0, registry.connectionCount());
    }

    @Test
    void broadcast_shouldReachGlobalSubscribersOnly() {
        FakeEventConnection global = new FakeEventConnection("g");
        FakeEventConnection job = new FakeEventConnection("j");
        registry.subscribe(global, SubscriptionScope.GLOBAL, null);
        registry.subscribe(job, SubscriptionScope.JOB, "job-1");

        assertEquals(1, registry.broadcast(event("announcement")));
        assertEquals(1, global.sent.size());
        assertTrue(job.sent.isEmpty());
    }

    @Test
    void pingAll_shouldRemoveClosedAndBrokenConnections() {
        FakeEventConnection alive = new FakeEventConnection("alive");
        FakeEventConnection closed = new FakeEventConnection("closed");
        closed.open = false;
        FakeEventConnection broken = new FakeEventConnection("broken");
        broken.failOnSend = true;
        registry.subscribe(alive, SubscriptionScope.GLOBAL, null);
        registry.subscribe(closed, SubscriptionScope.JOB, "job-1");
        registry.subscribe(broken, SubscriptionScope.USER, "user-1");

        int removed = registry.pingAll();

        assertEquals(2, removed);
        assertEquals(1, registry.connectionCount());
        assertTrue(alive.sent.get(0).contains("\"type\":\"ping\""));
        assertEquals(0, registry.subscriberCount(SubscriptionScope.JOB, "job-1"));
    }

    @Test
    void closeAll_shouldCloseEveryConnection() {
        FakeEventConnection a = new FakeEventConnection("a");
        FakeEventConnection b = new FakeEventConnection("b");
        registry.register(a);
        registry.subscribe(b, SubscriptionScope.JOB, "job-1");

        registry.closeAll();

        assertTrue(a.closed);
        assertTrue(b.closed);
        assertEquals(0, registry.connectionCount());
    }

    @Test
    void sendTo_shouldReturnFalse_whenSendFails() {
        FakeEventConnection broken = new FakeEventConnection("x");
        broken.failOnSend = true;

        assertFalse(registry.sendTo(broken, event("pong")));
        verify(metricsRecorder).recordEventDeliveryFailure("direct");
    }

    private static Map<String, Object> event(String type) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type);
        return event;
    }
}
