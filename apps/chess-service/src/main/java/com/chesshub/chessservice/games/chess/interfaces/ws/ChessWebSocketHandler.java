package com.chesshub.chessservice.games.chess.interfaces.ws;

import com.chesshub.chessservice.games.chess.service.ChessRoomService;
import com.chesshub.chessservice.platform.ws.ConnectParams;
import com.chesshub.chessservice.platform.ws.WebSocketPlayerConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * 对局 WebSocket 入口：连接建立 -> 入座；文本消息 -> 指令；断开 -> 离座。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChessWebSocketHandler extends TextWebSocketHandler {

    private final ChessRoomService roomService;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ConnectParams params = paramsOf(session);
        if (params == null) {
            log.warn("连接缺少握手参数，关闭: sessionId={}", session.getId());
            closeQuietly(session);
            return;
        }
        roomService.join(params.roomId(), new WebSocketPlayerConnection(session, params), params.preference());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectParams params = paramsOf(session);
        if (params == null) return;
        roomService.handleMessage(params.roomId(), session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("传输错误: sessionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectParams params = paramsOf(session);
        if (params == null) return;
        roomService.leave(params.roomId(), session.getId());
    }

    private static ConnectParams paramsOf(WebSocketSession session) {
        Object v = session.getAttributes().get(ConnectParams.ATTRIBUTE);
        return v instanceof ConnectParams p ? p : null;
    }

    private static void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.BAD_DATA);
        } catch (IOException e) {
            log.warn("关闭连接失败: sessionId={}, error={}", session.getId(), e.getMessage());
        }
    }
}
