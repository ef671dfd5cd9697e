package com.tripscout.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 三个实时端点共用的处理器：
 * - /ws/research/{jobId}：订阅单个任务，支持 subscribe 切换任务；
 * - /ws/user/{userId}：订阅某个用户的任务结束通知；
 * - /ws/global：全局公告。
 *
 * 客户端消息：ping 回 pong，非法 JSON 回 error，其它动作回 ack。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CONNECTION = "tripscout.connection";
    static final String ATTR_SCOPE = "tripscout.scope";
    static final String ATTR_SCOPE_ID = "tripscout.scopeId";

    private final ConnectionRegistry connectionRegistry;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        EventConnection connection = new WebSocketEventConnection(session);
        String[] target = resolveTarget(session.getUri());
        SubscriptionScope scope = SubscriptionScope.valueOf(target[0]);
        String scopeId = target[1];

        session.getAttributes().put(ATTR_CONNECTION, connection);
        session.getAttributes().put(ATTR_SCOPE, scope);
        session.getAttributes().put(ATTR_SCOPE_ID, scopeId);
        connectionRegistry.subscribe(connection, scope, scopeId);

        Map<String, Object> connected = new LinkedHashMap<>();
        connected.put("type", "connected");
        switch (scope) {
            case JOB -> {
                connected.put("job_id", scopeId);
                connected.put("message", "Connected to research job " + scopeId);
            }
            case USER -> {
                connected.put("user_id", scopeId);
                connected.put("message", "Connected to user channel " + scopeId);
            }
            default -> connected.put("message", "Connected to global channel");
        }
        connectionRegistry.sendTo(connection, connected);
        log.info("WebSocket 已连接, connId={}, scope={}, id={}", connection.getId(), scope, scopeId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        EventConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("type", "error");
            error.put("message", "Invalid JSON");
            connectionRegistry.sendTo(connection, error);
            return;
        }
        String action = node.path("action").asText("");
        Map<String, Object> reply = new LinkedHashMap<>();
        if ("ping".equals(action)) {
            reply.put("type", "pong");
            reply.put("timestamp", node.hasNonNull("timestamp") ? toValue(node.get("timestamp")) : null);
        } else if ("subscribe".equals(action) && session.getAttributes().get(ATTR_SCOPE) == SubscriptionScope.JOB) {
            String current = (String) session.getAttributes().get(ATTR_SCOPE_ID);
            String next = node.path("job_id").asText("");
            if (!StringUtils.hasText(next)) {
                reply.put("type", "error");
                reply.put("message", "job_id is required");
            } else {
                if (!next.equals(current)) {
                    connectionRegistry.resubscribeJob(connection, current, next);
                    session.getAttributes().put(ATTR_SCOPE_ID, next);
                }
                reply.put("type", "subscribed");
                reply.put("job_id", next);
            }
        } else {
            reply.put("type", "ack");
            reply.put("received", toValue(node));
        }
        connectionRegistry.sendTo(connection, reply);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket 传输异常, sessionId={}, err={}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("WebSocket 已断开, sessionId={}, status={}", session.getId(), status);
        release(session);
    }

    private void release(WebSocketSession session) {
        EventConnection connection = connectionOf(session);
        if (connection != null) {
            connectionRegistry.disconnect(connection);
        }
    }

    private EventConnection connectionOf(WebSocketSession session) {
        return (EventConnection) session.getAttributes().get(ATTR_CONNECTION);
    }

    private Object toValue(JsonNode node) {
        return objectMapper.convertValue(node, Object.class);
    }

    /**
     * 根据请求路径解析订阅范围：返回 [scope, id]。
     */
    static String[] resolveTarget(URI uri) {
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath();
        int research = path.indexOf("/ws/research/");
        if (research >= 0) {
            return new String[]{SubscriptionScope.JOB.name(), lastSegment(path, research + "/ws/research/".length())};
        }
        int user = path.indexOf("/ws/user/");
        if (user >= 0) {
            return new String[]{SubscriptionScope.USER.name(), lastSegment(path, user + "/ws/user/".length())};
        }
        return new String[]{SubscriptionScope.GLOBAL.name(), null};
    }

    private static String lastSegment(String path, int start) {
        String rest = path.substring(start);
        int slash = rest.indexOf('/');
        return slash >= 0 ? rest.substring(0, slash) : rest;
    }
}
