package com.chesshub.chessservice.games.chess.interfaces.http.dto;

import com.chesshub.chessservice.games.chess.domain.enums.Seat;
import com.chesshub.chessservice.games.chess.domain.model.Room;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 房间列表的单行摘要信息。
 * 需在房间锁内调用 {@link #from(Room)}。
 */
@Data
@AllArgsConstructor
public class RoomSummary {
    private String roomId;
    private String phase;
    private boolean whiteOccupied;
    private boolean blackOccupied;
    private int spectators;
    private int moveCount;
    private long createdAt;
    private boolean finalizeFailed;

    public static RoomSummary from(Room room) {
        return new RoomSummary(
                room.getId(),
                room.phase().name(),
                room.occupied(Seat.WHITE),
                room.occupied(Seat.BLACK),
                room.spectatorCount(),
                room.getMoveHistory().size(),
                room.getCreatedAt().toEpochMilli(),
                room.isFinalizeFailed()
        );
    }
}
