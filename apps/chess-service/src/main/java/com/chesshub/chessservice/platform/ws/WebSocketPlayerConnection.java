package com.chesshub.chessservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * 基于 Spring {@link WebSocketSession} 的连接实现。
 */
@Slf4j
public class WebSocketPlayerConnection implements PlayerConnection {

    private final WebSocketSession session;
    private final ConnectParams params;

    public WebSocketPlayerConnection(WebSocketSession session, ConnectParams params) {
        this.session = session;
        this.params = params;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public Long userId() {
        return params.userId();
    }

    @Override
    public String username() {
        return params.username();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            log.warn("关闭连接失败: sessionId={}, error={}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
