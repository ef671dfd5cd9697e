package com.tripscout.server.config;

import com.tripscout.server.ws.ResearchWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 注册调研进度相关的 WebSocket 端点。
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfiguration implements WebSocketConfigurer {

    private final ResearchWebSocketHandler researchWebSocketHandler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(researchWebSocketHandler,
                        "/ws/research/{jobId}", "/ws/user/{userId}", "/ws/global")
                .setAllowedOriginPatterns("*");
    }
}
