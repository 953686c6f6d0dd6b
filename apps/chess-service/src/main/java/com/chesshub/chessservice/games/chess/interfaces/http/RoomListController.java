package com.chesshub.chessservice.games.chess.interfaces.http;

import com.chesshub.chessservice.games.chess.domain.model.Room;
import com.chesshub.chessservice.games.chess.domain.rule.RulesEngine;
import com.chesshub.chessservice.games.chess.interfaces.http.dto.RoomDetail;
import com.chesshub.chessservice.games.chess.interfaces.http.dto.RoomSummary;
import com.chesshub.chessservice.games.chess.service.RoomRegistry;
import com.chesshub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 国际象棋大厅 - 房间列表查询（仅用于大厅展示）
 *
 * 暂不做鉴权，前端可直接调用。
 */
@RestController
@RequestMapping("/api/chess/rooms")
@RequiredArgsConstructor
public class RoomListController {

    private final RoomRegistry registry;
    private final RulesEngine rules;

    /**
     * 全部房间，新建的在前
     */
    @GetMapping
    public ApiResponse<List<RoomSummary>> list() {
        List<RoomSummary> items = new ArrayList<>();
        for (Room room : registry.all()) {
            items.add(room.withLock(() -> RoomSummary.from(room)));
        }
        return ApiResponse.success(items);
    }

    @GetMapping("/{roomId}")
    public ApiResponse<RoomDetail> detail(@PathVariable String roomId) {
        Room room = registry.find(roomId)
                .orElseThrow(() -> new NoSuchElementException("Room not found: " + roomId));
        RoomDetail detail = room.withLock(() -> new RoomDetail(
                RoomSummary.from(room),
                rules.serialize(room.getBoard()),
                List.copyOf(room.getMoveHistory())));
        return ApiResponse.success(detail);
    }
}
