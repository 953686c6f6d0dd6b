package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.TerminalReason;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * 已结束对局的归档记录（只追加，不修改）。
 * 参赛账号可能缺失（匿名入座），此时对应 id 为 null。
 */
@Builder
public record GameRecord(
        Long id,
        String roomId,
        Long whiteUserId,
        Long blackUserId,
        GameResult result,
        TerminalReason reason,
        List<String> moves,
        Instant createdAt,
        Instant finishedAt
) {
    /** 走子序列：UCI 以单个空格拼接 */
    public String movesText() {
        return moves == null ? "" : String.join(" ", moves);
    }
}
