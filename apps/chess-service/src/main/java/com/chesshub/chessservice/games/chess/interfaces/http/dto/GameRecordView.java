package com.chesshub.chessservice.games.chess.interfaces.http.dto;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.TerminalReason;
import com.chesshub.chessservice.games.chess.domain.model.GameRecord;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 对局记录（HTTP 层专用 DTO）。
 */
@Data
@AllArgsConstructor
public class GameRecordView {
    private Long id;
    private String roomId;
    private Long whiteUserId;
    private Long blackUserId;
    private GameResult result;
    private TerminalReason reason;
    private List<String> moves;
    private long createdAt;
    private long finishedAt;

    public static GameRecordView from(GameRecord r) {
        return new GameRecordView(
                r.id(),
                r.roomId(),
                r.whiteUserId(),
                r.blackUserId(),
                r.result(),
                r.reason(),
                r.moves(),
                r.createdAt().toEpochMilli(),
                r.finishedAt().toEpochMilli()
        );
    }
}
