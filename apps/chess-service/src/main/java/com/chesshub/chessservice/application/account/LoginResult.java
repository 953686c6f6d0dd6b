package com.chesshub.chessservice.application.account;

/**
 * 登录结果：客户端连接 WebSocket 时以 user_id / username 自报身份。
 */
public record LoginResult(Long userId, String username) {
}
