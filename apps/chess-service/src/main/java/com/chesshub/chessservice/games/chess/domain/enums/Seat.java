package com.chesshub.chessservice.games.chess.domain.enums;

import com.chesshub.chessservice.games.chess.domain.rule.PieceColor;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 连接在房间内的座位：白方 / 黑方 / 观战。
 * 线上协议使用 "w" / "b" / "spectator"。
 */
public enum Seat {
    WHITE("w"),
    BLACK("b"),
    SPECTATOR("spectator");

    private final String code;

    Seat(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** 是否为执子座位（白/黑） */
    public boolean isPlayer() {
        return this != SPECTATOR;
    }

    /** 执子座位对应的棋子颜色；观战返回 null */
    public PieceColor color() {
        return switch (this) {
            case WHITE -> PieceColor.WHITE;
            case BLACK -> PieceColor.BLACK;
            case SPECTATOR -> null;
        };
    }

    public static Seat of(PieceColor color) {
        return color == PieceColor.WHITE ? WHITE : BLACK;
    }
}
