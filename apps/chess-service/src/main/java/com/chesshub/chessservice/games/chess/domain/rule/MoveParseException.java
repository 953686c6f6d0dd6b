package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * 走法文本无法解析（格式不是坐标记法）。
 */
public class MoveParseException extends IllegalArgumentException {

    public MoveParseException(String text) {
        super("MALFORMED_MOVE: " + text);
    }
}
