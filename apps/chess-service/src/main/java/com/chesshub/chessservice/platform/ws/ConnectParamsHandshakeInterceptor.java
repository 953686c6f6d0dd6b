package com.chesshub.chessservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * 握手拦截：从 /ws/{roomId}?user_id=&username=&preferred= 解析连接参数，
 * 放入会话属性供 {@code ChessWebSocketHandler} 使用。房间 id 为空时拒绝握手。
 */
@Slf4j
public class ConnectParamsHandshakeInterceptor implements HandshakeInterceptor {

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        URI uri = request.getURI();
        String roomId = roomIdOf(uri.getRawPath());
        if (StringUtils.isBlank(roomId)) {
            log.warn("握手缺少房间 id: uri={}", uri);
            return false;
        }

        Map<String, String> query = new HashMap<>();
        UriComponentsBuilder.fromUri(uri).build().getQueryParams()
                .forEach((k, v) -> query.put(k, v.isEmpty() ? null : decodeQueryValue(v.get(0))));

        attributes.put(ConnectParams.ATTRIBUTE, ConnectParams.parse(roomId, query));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // 无需处理
    }

    /** 路径最后一段即房间 id；以 "/" 结尾视为缺失。路径段只做百分号解码，"+" 保持原样 */
    static String roomIdOf(String path) {
        if (path == null) return null;
        return StringUtils.trimToNull(UriUtils.decode(StringUtils.substringAfterLast(path, "/"), StandardCharsets.UTF_8));
    }

    /** 查询参数按表单编码解码（"+" 即空格） */
    private static String decodeQueryValue(String raw) {
        if (raw == null) return null;
        return URLDecoder.decode(raw, StandardCharsets.UTF_8);
    }
}
