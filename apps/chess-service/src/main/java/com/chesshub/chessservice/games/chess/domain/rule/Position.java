package com.chesshub.chessservice.games.chess.domain.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * 国际象棋局面（可变）。
 * 作用：整盘棋的“单一事实来源”：棋子分布、行棋方、易位权、过路兵格、半回合计数、回合数，
 * 以及用于重复局面判定的历史键。
 * <p>
 * 约定：Position 本身不做规则校验，只存状态；走子与合法性统一交给 {@link MoveGenerator} /
 * {@link StandardChessRules}。
 */
public class Position {

    /** 易位权位掩码 */
    public static final int WHITE_KINGSIDE = 1;
    public static final int WHITE_QUEENSIDE = 2;
    public static final int BLACK_KINGSIDE = 4;
    public static final int BLACK_QUEENSIDE = 8;

    private final Piece[] squares = new Piece[64];
    private PieceColor turn = PieceColor.WHITE;
    private int castlingRights;
    private int epSquare = Squares.NONE;
    private int halfmoveClock;
    private int fullmoveNumber = 1;

    /** 每个已出现局面的重复键（含当前局面），按时间顺序 */
    private final List<String> repetitionKeys = new ArrayList<>();

    public Piece get(int sq) {
        return squares[sq];
    }

    public void set(int sq, Piece piece) {
        squares[sq] = piece;
    }

    public PieceColor turn() {
        return turn;
    }

    public void setTurn(PieceColor turn) {
        this.turn = turn;
    }

    public int castlingRights() {
        return castlingRights;
    }

    public void setCastlingRights(int castlingRights) {
        this.castlingRights = castlingRights;
    }

    public boolean hasCastlingRight(int flag) {
        return (castlingRights & flag) != 0;
    }

    public int epSquare() {
        return epSquare;
    }

    public void setEpSquare(int epSquare) {
        this.epSquare = epSquare;
    }

    public int halfmoveClock() {
        return halfmoveClock;
    }

    public void setHalfmoveClock(int halfmoveClock) {
        this.halfmoveClock = halfmoveClock;
    }

    public int fullmoveNumber() {
        return fullmoveNumber;
    }

    public void setFullmoveNumber(int fullmoveNumber) {
        this.fullmoveNumber = fullmoveNumber;
    }

    /** 记录当前局面的重复键 */
    public void recordRepetitionKey(String key) {
        repetitionKeys.add(key);
    }

    /** 当前局面（最后一个键）在历史中出现的次数 */
    public int currentRepetitionCount() {
        if (repetitionKeys.isEmpty()) return 0;
        String current = repetitionKeys.get(repetitionKeys.size() - 1);
        int n = 0;
        for (String k : repetitionKeys) {
            if (k.equals(current)) n++;
        }
        return n;
    }

    /** 查找某方王的位置；不存在返回 {@link Squares#NONE} */
    public int kingSquare(PieceColor color) {
        for (int sq = 0; sq < 64; sq++) {
            Piece p = squares[sq];
            if (p != null && p.is(color, PieceType.KING)) return sq;
        }
        return Squares.NONE;
    }

    /** 深拷贝（规则层模拟走子时使用，确保不污染实盘） */
    public Position copy() {
        Position p = new Position();
        System.arraycopy(squares, 0, p.squares, 0, 64);
        p.turn = turn;
        p.castlingRights = castlingRights;
        p.epSquare = epSquare;
        p.halfmoveClock = halfmoveClock;
        p.fullmoveNumber = fullmoveNumber;
        p.repetitionKeys.addAll(repetitionKeys);
        return p;
    }
}
