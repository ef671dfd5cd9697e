package com.tripscout.server.ws;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 测试用连接：记录收到的消息，可模拟发送失败。
 */
class FakeEventConnection implements EventConnection {

    final List<String> sent = new CopyOnWriteArrayList<>();
    private final String id;
    volatile boolean open = true;
    volatile boolean failOnSend;
    volatile boolean closed;

    FakeEventConnection(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String payload) throws IOException {
        if (failOnSend) {
            throw new IOException("broken pipe");
        }
        sent.add(payload);
    }

    @Override
    public void close() {
        closed = true;
        open = false;
    }
}
