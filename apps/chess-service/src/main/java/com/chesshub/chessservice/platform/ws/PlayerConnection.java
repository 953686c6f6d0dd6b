package com.chesshub.chessservice.platform.ws;

import java.io.IOException;

/**
 * 一条在线连接（一个客户端会话）。
 * userId / username 由客户端自报，不做认证。
 */
public interface PlayerConnection {

    String id();

    Long userId();

    String username();

    /** 同步发送一帧文本；同一连接不会被并发调用 */
    void send(String payload) throws IOException;

    void close();

    boolean isOpen();
}
