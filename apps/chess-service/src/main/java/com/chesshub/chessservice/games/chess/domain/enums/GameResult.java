package com.chesshub.chessservice.games.chess.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** 对局结果：白胜 / 黑胜 / 和棋 */
public enum GameResult {
    WHITE("white"),
    BLACK("black"),
    DRAW("draw");

    private final String code;

    GameResult(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static GameResult fromCode(String code) {
        for (GameResult r : values()) {
            if (r.code.equals(code)) return r;
        }
        throw new IllegalArgumentException("UNKNOWN_RESULT: " + code);
    }
}
