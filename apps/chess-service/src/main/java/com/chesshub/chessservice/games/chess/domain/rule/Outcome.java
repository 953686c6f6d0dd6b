package com.chesshub.chessservice.games.chess.domain.rule;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.TerminalReason;

/**
 * 终局判定结果：结果 + 原因（终局时恰好产生一对）。
 */
public record Outcome(GameResult result, TerminalReason reason) {

    /** 将死：被将死的一方为 loser */
    public static Outcome checkmate(PieceColor loser) {
        return new Outcome(loser == PieceColor.WHITE ? GameResult.BLACK : GameResult.WHITE, TerminalReason.CHECKMATE);
    }

    public static Outcome draw(TerminalReason reason) {
        return new Outcome(GameResult.DRAW, reason);
    }
}
