package com.tripscout.server.ws;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 每 30 秒给所有实时连接发一次 ping，顺带清理已经断开的连接。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionKeepAliveTask {

    private final ConnectionRegistry connectionRegistry;

    @Scheduled(fixedDelay = 30_000L)
    public void pingConnections() {
        int removed = connectionRegistry.pingAll();
        if (removed > 0) {
            log.info("心跳清理断开的连接, removed={}, remaining={}", removed, connectionRegistry.connectionCount());
        }
    }
}
