package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * 一枚棋子：颜色 + 兵种。
 * FEN 约定：白方大写、黑方小写。
 */
public record Piece(PieceColor color, PieceType type) {

    public char fenChar() {
        char c = type.symbol();
        return color == PieceColor.WHITE ? Character.toUpperCase(c) : c;
    }

    public boolean is(PieceColor c, PieceType t) {
        return color == c && type == t;
    }

    /** 解析 FEN 棋子字符；非法字符返回 null */
    public static Piece fromFen(char c) {
        PieceType t = PieceType.fromSymbol(c);
        if (t == null) return null;
        return new Piece(Character.isUpperCase(c) ? PieceColor.WHITE : PieceColor.BLACK, t);
    }
}
