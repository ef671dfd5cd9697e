package com.tripscout.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripscout.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 实时连接注册表：维护 任务 / 用户 / 全局 三类订阅集合。
 *
 * 约定：
 * - 所有集合的修改都在同一把锁内完成；
 * - 推送时先在锁内拷贝订阅者快照，再在锁外逐个发送；
 * - 某个连接发送失败只会把它从本次推送的范围中移除，其它连接照常投递；
 * - 每条消息都会带上 timestamp。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionRegistry {

    private final ObjectMapper objectMapper;
    private final MetricsRecorder metricsRecorder;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Set<EventConnection>> jobSubscribers = new HashMap<>();
    private final Map<String, Set<EventConnection>> userSubscribers = new HashMap<>();
    private final Set<EventConnection> globalSubscribers = new LinkedHashSet<>();
    /** 所有已登记的连接，关闭时统一清理 */
    private final Set<EventConnection> connections = new LinkedHashSet<>();

    public void register(EventConnection connection) {
        lock.lock();
        try {
            connections.add(connection);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 加入订阅集合。GLOBAL 范围忽略 id。
     */
    public void subscribe(EventConnection connection, SubscriptionScope scope, String id) {
        lock.lock();
        try {
            connections.add(connection);
            setOf(scope, id, true).add(connection);
        } finally {
            lock.unlock();
        }
        log.debug("连接订阅, connId={}, scope={}, id={}", connection.getId(), scope, id);
    }

    public void unsubscribe(EventConnection connection, SubscriptionScope scope, String id) {
        lock.lock();
        try {
            removeFrom(scope, id, connection);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 原子地把连接从旧任务切换到新任务，切换过程中不会同时属于两个任务，也不会短暂不属于任何任务。
     */
    public void resubscribeJob(EventConnection connection, String oldJobId, String newJobId) {
        lock.lock();
        try {
            if (oldJobId != null) {
                removeFrom(SubscriptionScope.JOB, oldJobId, connection);
            }
            connections.add(connection);
            setOf(SubscriptionScope.JOB, newJobId, true).add(connection);
        } finally {
            lock.unlock();
        }
        log.debug("连接切换任务订阅, connId={}, {} -> {}", connection.getId(), oldJobId, newJobId);
    }

    /**
     * 从所有集合中移除该连接。
     */
    public void disconnect(EventConnection connection) {
        lock.lock();
        try {
            jobSubscribers.values().forEach(s -> s.remove(connection));
            jobSubscribers.values().removeIf(Set::isEmpty);
            userSubscribers.values().forEach(s -> s.remove(connection));
            userSubscribers.values().removeIf(Set::isEmpty);
            globalSubscribers.remove(connection);
            connections.remove(connection);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 向某个范围的所有订阅者推送消息，返回成功送达的连接数。
     */
    public int publish(SubscriptionScope scope, String id, Map<String, Object> event) {
        List<EventConnection> targets;
        lock.lock();
        try {
            Set<EventConnection> set = setOf(scope, id, false);
            targets = set == null ? List.of() : new ArrayList<>(set);
        } finally {
            lock.unlock();
        }
        if (targets.isEmpty()) {
            return 0;
        }
        String payload = serialize(event);
        if (payload == null) {
            return 0;
        }
        int delivered = 0;
        for (EventConnection connection : targets) {
            try {
                connection.send(payload);
                delivered++;
            } catch (Exception e) {
                log.warn("推送失败，移除订阅, scope={}, id={}, connId={}, err={}",
                        scope, id, connection.getId(), e.getMessage());
                metricsRecorder.recordEventDeliveryFailure(scope.name().toLowerCase());
                unsubscribe(connection, scope, id);
            }
        }
        return delivered;
    }

    public int broadcast(Map<String, Object> event) {
        return publish(SubscriptionScope.GLOBAL, null, event);
    }

    /**
     * 直接回复某个连接（握手确认、pong 等），失败时返回 false。
     */
    public boolean sendTo(EventConnection connection, Map<String, Object> event) {
        String payload = serialize(event);
        if (payload == null) {
            return false;
        }
        try {
            connection.send(payload);
            return true;
        } catch (Exception e) {
            log.warn("回复连接失败, connId={}, err={}", connection.getId(), e.getMessage());
            metricsRecorder.recordEventDeliveryFailure("direct");
            return false;
        }
    }

    /**
     * 心跳：向所有已登记的连接发送 ping，已关闭或发送失败的连接直接清理。
     */
    public int pingAll() {
        List<EventConnection> all;
        lock.lock();
        try {
            all = new ArrayList<>(connections);
        } finally {
            lock.unlock();
        }
        Map<String, Object> ping = new LinkedHashMap<>();
        ping.put("type", "ping");
        int removed = 0;
        for (EventConnection connection : all) {
            if (!connection.isOpen() || !sendTo(connection, ping)) {
                disconnect(connection);
                removed++;
            }
        }
        return removed;
    }

    public int subscriberCount(SubscriptionScope scope, String id) {
        lock.lock();
        try {
            Set<EventConnection> set = setOf(scope, id, false);
            return set == null ? 0 : set.size();
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void closeAll() {
        List<EventConnection> all;
        lock.lock();
        try {
            all = new ArrayList<>(connections);
            connections.clear();
            jobSubscribers.clear();
            userSubscribers.clear();
            globalSubscribers.clear();
        } finally {
            lock.unlock();
        }
        all.forEach(EventConnection::close);
        log.info("已关闭全部实时连接, count={}", all.size());
    }

    /**
     * 调用方必须持有锁。
     */
    private Set<EventConnection> setOf(SubscriptionScope scope, String id, boolean create) {
        return switch (scope) {
            case GLOBAL -> globalSubscribers;
            case JOB -> create
                    ? jobSubscribers.computeIfAbsent(id, k -> new LinkedHashSet<>())
                    : jobSubscribers.get(id);
            case USER -> create
                    ? userSubscribers.computeIfAbsent(id, k -> new LinkedHashSet<>())
                    : userSubscribers.get(id);
        };
    }

    private void removeFrom(SubscriptionScope scope, String id, EventConnection connection) {
        Set<EventConnection> set = setOf(scope, id, false);
        if (set == null) {
            return;
        }
        set.remove(connection);
        if (set.isEmpty()) {
            if (scope == SubscriptionScope.JOB) {
                jobSubscribers.remove(id);
            } else if (scope == SubscriptionScope.USER) {
                userSubscribers.remove(id);
            }
        }
    }

    private String serialize(Map<String, Object> event) {
        Map<String, Object> payload = new LinkedHashMap<>(event);
        payload.putIfAbsent("timestamp", LocalDateTime.now().toString());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("实时消息序列化失败, type={}", event.get("type"), e);
            return null;
        }
    }
}
