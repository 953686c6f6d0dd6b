package com.chesshub.chessservice.platform.ws;

import com.chesshub.chessservice.games.chess.interfaces.ws.ChessWebSocketHandler;
import com.chesshub.chessservice.platform.config.ChessProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 原生 WebSocket 端点注册：/ws/{roomId}
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChessWebSocketHandler chessWebSocketHandler;
    private final ChessProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chessWebSocketHandler, properties.getWs().getPath() + "/*")
                .addInterceptors(new ConnectParamsHandshakeInterceptor())
                .setAllowedOriginPatterns(properties.getWs().getAllowedOrigins().toArray(String[]::new));
    }
}
