package com.tripscout.server.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * WebSocketSession 的包装。原生 session 不允许并发发送，这里用 ConcurrentWebSocketSessionDecorator 串行化，
 * 发送超时或缓冲超限时由装饰器关闭连接。
 */
@Slf4j
public class WebSocketEventConnection implements EventConnection {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketEventConnection(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("关闭 WebSocket 连接失败, id={}, err={}", getId(), e.getMessage());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WebSocketEventConnection)) {
            return false;
        }
        return getId().equals(((WebSocketEventConnection) o).getId());
    }

    @Override
    public int hashCode() {
        return getId().hashCode();
    }
}
