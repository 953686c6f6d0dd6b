package com.chesshub.chessservice.platform.online;

/** 在线用户（至少有一条打开的连接） */
public record OnlineUser(Long userId, String username) {
}
