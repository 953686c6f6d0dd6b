package com.chesshub.chessservice.games.chess.domain.rule;

/** 棋子颜色（白先） */
public enum PieceColor {
    WHITE('w'),
    BLACK('b');

    private final char fen;

    PieceColor(char fen) {
        this.fen = fen;
    }

    /** FEN 中行棋方字段：'w' 或 'b' */
    public char fen() {
        return fen;
    }

    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }
}
