package com.chesshub.chessservice.games.chess.domain.rule;

/** 兵种，symbol 为 FEN / UCI 中的小写字母 */
public enum PieceType {
    PAWN('p'),
    KNIGHT('n'),
    BISHOP('b'),
    ROOK('r'),
    QUEEN('q'),
    KING('k');

    private final char symbol;

    PieceType(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /** 按小写字母解析兵种；无法识别返回 null */
    public static PieceType fromSymbol(char c) {
        char lower = Character.toLowerCase(c);
        for (PieceType t : values()) {
            if (t.symbol == lower) return t;
        }
        return null;
    }

    /** 升变可选的兵种 */
    public boolean isPromotionTarget() {
        return this == KNIGHT || this == BISHOP || this == ROOK || this == QUEEN;
    }
}
