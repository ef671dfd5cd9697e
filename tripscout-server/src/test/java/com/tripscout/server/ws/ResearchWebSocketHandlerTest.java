package com.tripscout.server.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResearchWebSocketHandler 单元测试：路径解析、连接确认、ping/pong、订阅切换、非法 JSON 与断开清理。
 */
@ExtendWith(MockitoExtension.class)
class ResearchWebSocketHandlerTest {

    @Mock
    private ConnectionRegistry connectionRegistry;

    @Mock
    private WebSocketSession session;

    private final Map<String, Object> attributes = new HashMap<>();
    private ResearchWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ResearchWebSocketHandler(connectionRegistry, new ObjectMapper());
        lenient().when(session.getId()).thenReturn("session-1");
        lenient().when(session.getAttributes()).thenReturn(attributes);
    }

    @Test
    void resolveTarget_shouldMapPathsToScopes() {
        assertArrayEquals(new String[]{"JOB", "job-42"}, ResearchWebSocketHandler.resolveTarget(URI.create("ws://localhost/ws/research/job-42")));
        assertArrayEquals(new String[]{"USER", "u-1"}, ResearchWebSocketHandler.resolveTarget(URI.create("ws://localhost/ws/user/u-1")));
        assertArrayEquals(new String[]{"GLOBAL", null}, ResearchWebSocketHandler.resolveTarget(URI.create("ws://localhost/ws/global")));
    }

    @Test
    void afterConnectionEstablished_shouldSubscribeAndConfirm() {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/ws/research/job-42"));

        handler.afterConnectionEstablished(session);

        verify(connectionRegistry).subscribe(any(EventConnection.class), eq(SubscriptionScope.JOB), eq("job-42"));
        Map<String, Object> reply = lastReply();
        assertEquals("connected", reply.get("type"));
        assertEquals("job-42", reply.get("job_id"));
        assertEquals(SubscriptionScope.JOB, attributes.get(ResearchWebSocketHandler.ATTR_SCOPE));
    }

    @Test
    void handleTextMessage_shouldAnswerPingWithPong() throws Exception {
        connect("ws://localhost/ws/research/job-42");

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"ping\",\"timestamp\":1700000000}"));

        Map<String, Object> reply = lastReply();
        assertEquals("pong", reply.get("type"));
        assertEquals(1700000000, reply.get("timestamp"));
    }

    @Test
    void handleTextMessage_shouldSwitchJobSubscription() throws Exception {
        connect("ws://localhost/ws/research/job-old");

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"job_id\":\"job-new\"}"));

        verify(connectionRegistry).resubscribeJob(any(EventConnection.class), eq("job-old"), eq("job-new"));
        assertEquals("job-new", attributes.get(ResearchWebSocketHandler.ATTR_SCOPE_ID));
        Map<String, Object> reply = lastReply();
        assertEquals("subscribed", reply.get("type"));
        assertEquals("job-new", reply.get("job_id"));
    }

    @Test
    void handleTextMessage_shouldRejectSubscribeWithoutJobId() throws Exception {
        connect("ws://localhost/ws/research/job-old");

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\"}"));

        verify(connectionRegistry, never()).resubscribeJob(any(), any(), any());
        assertEquals("error", lastReply().get("type"));
    }

    @Test
    void handleTextMessage_shouldAckSubscribeOnGlobalChannel() throws Exception {
        connect("ws://localhost/ws/global");

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"job_id\":\"job-1\"}"));

        verify(connectionRegistry, never()).resubscribeJob(any(), any(), any());
        Map<String, Object> reply = lastReply();
        assertEquals("ack", reply.get("type"));
        assertEquals(Map.of("action", "subscribe", "job_id", "job-1"), reply.get("received"));
    }

    @Test
    void handleTextMessage_shouldReportInvalidJson() throws Exception {
        connect("ws://localhost/ws/user/u-1");

        handler.handleTextMessage(session, new TextMessage("not json"));

        Map<String, Object> reply = lastReply();
        assertEquals("error", reply.get("type"));
        assertEquals("Invalid JSON", reply.get("message"));
    }

    @Test
    void afterConnectionClosed_shouldDisconnect() {
        connect("ws://localhost/ws/user/u-1");

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(connectionRegistry).disconnect(any(EventConnection.class));
    }

    @Test
    void afterConnectionClosed_shouldIgnoreUnknownSession() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertNull(attributes.get(ResearchWebSocketHandler.ATTR_CONNECTION));
        verify(connectionRegistry, never()).disconnect(any());
    }

    private void connect(String uri) {
        when(session.getUri()).thenReturn(URI.create(uri));
        handler.afterConnectionEstablished(session);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> lastReply() {
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(connectionRegistry, org.mockito.Mockito.atLeastOnce()).sendTo(any(EventConnection.class), captor.capture());
        List<Map<String, Object>> all = captor.getAllValues();
        return all.get(all.size() - 1);
    }
}
