package com.tripscout.server.ws;

import java.io.IOException;

/**
 * 一个可以推送文本消息的实时连接。
 */
public interface EventConnection {

    String getId();

    boolean isOpen();

    void send(String payload) throws IOException;

    void close();
}
