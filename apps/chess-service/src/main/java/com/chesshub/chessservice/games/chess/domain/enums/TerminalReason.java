package com.chesshub.chessservice.games.chess.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 终局原因代码。声明顺序即判定优先级：
 * 将死 > 逼和 > 子力不足 > 三次重复 > 五十步 > 其它和棋。
 */
public enum TerminalReason {
    CHECKMATE("checkmate"),
    STALEMATE("stalemate"),
    INSUFFICIENT_MATERIAL("insufficient_material"),
    THREEFOLD_REPETITION("threefold_repetition"),
    FIFTY_MOVE_RULE("fifty_move_rule"),
    DRAW("draw");

    private final String code;

    TerminalReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static TerminalReason fromCode(String code) {
        for (TerminalReason r : values()) {
            if (r.code.equals(code)) return r;
        }
        throw new IllegalArgumentException("UNKNOWN_REASON: " + code);
    }
}
