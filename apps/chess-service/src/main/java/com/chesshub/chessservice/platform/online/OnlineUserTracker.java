package com.chesshub.chessservice.platform.online;

import com.chesshub.chessservice.platform.ws.ConnectionManager;
import com.chesshub.chessservice.platform.ws.PlayerConnection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在线用户查询：基于当前打开的连接，按 userId 去重。
 * 只统计同时自报了 user_id 与 username 的连接。
 */
@Component
@RequiredArgsConstructor
public class OnlineUserTracker {

    private final ConnectionManager connectionManager;

    public List<OnlineUser> onlineUsers() {
        Map<Long, String> byUserId = new LinkedHashMap<>();
        for (PlayerConnection c : connectionManager.allConnections()) {
            if (c.userId() == null || c.username() == null || !c.isOpen()) continue;
            byUserId.put(c.userId(), c.username());
        }
        List<OnlineUser> list = new ArrayList<>(byUserId.size());
        byUserId.forEach((id, name) -> list.add(new OnlineUser(id, name)));
        return list;
    }
}
