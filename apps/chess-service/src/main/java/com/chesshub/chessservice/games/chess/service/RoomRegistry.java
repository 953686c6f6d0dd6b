package com.chesshub.chessservice.games.chess.service;

import com.chesshub.chessservice.games.chess.domain.model.Room;
import com.chesshub.chessservice.games.chess.domain.rule.RulesEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存房间表：房间 id -> Room。
 * 首次连接到未知 id 时建房，进程存活期间不删除。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomRegistry {

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    private final RulesEngine rules;
    private final Clock clock;

    /** 原子地取或建房：同一 id 并发调用只会创建一个实例 */
    public Room getOrCreate(String roomId) {
        return rooms.computeIfAbsent(roomId, id -> {
            log.info("创建房间: roomId={}", id);
            return new Room(id, rules.newBoard(), Instant.now(clock));
        });
    }

    public Optional<Room> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /** 全部房间，按创建时间倒序 */
    public List<Room> all() {
        List<Room> list = new ArrayList<>(rooms.values());
        list.sort(Comparator.comparing(Room::getCreatedAt).reversed());
        return list;
    }
}
