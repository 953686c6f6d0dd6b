package com.chesshub.chessservice.games.chess.domain.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * 走法生成与执行（纯规则逻辑，无状态）。
 * - 伪合法走法生成 + 王安全过滤 = 合法走法；
 * - 攻击判定（将军、易位路径）；
 * - 原始走子 {@link #play(Position, ChessMove)}：更新棋子、易位权、过路兵格与计数，不记录重复键。
 */
public final class MoveGenerator {

    private static final int[][] KNIGHT_STEPS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };
    private static final int[][] KING_STEPS = {
            {1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}
    };
    private static final int[][] ROOK_DIRS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_DIRS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};

    private static final PieceType[] PROMOTIONS = {
            PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT
    };

    private static final int A1 = Squares.parse("a1");
    private static final int H1 = Squares.parse("h1");
    private static final int A8 = Squares.parse("a8");
    private static final int H8 = Squares.parse("h8");
    private static final int E1 = Squares.parse("e1");
    private static final int E8 = Squares.parse("e8");

    private MoveGenerator() {
    }

    /** 当前行棋方的全部合法走法 */
    public static List<ChessMove> legalMoves(Position p) {
        List<ChessMove> legal = new ArrayList<>();
        PieceColor us = p.turn();
        for (ChessMove m : pseudoLegalMoves(p)) {
            if (leavesKingSafe(p, m, us)) legal.add(m);
        }
        return legal;
    }

    /** 某方是否被将军 */
    public static boolean inCheck(Position p, PieceColor color) {
        int king = p.kingSquare(color);
        return king != Squares.NONE && isAttacked(p, king, color.opposite());
    }

    /** 当前局面下，行棋方是否存在合法的吃过路兵 */
    public static boolean hasLegalEnPassant(Position p) {
        int ep = p.epSquare();
        if (ep == Squares.NONE) return false;
        PieceColor us = p.turn();
        int back = us == PieceColor.WHITE ? -1 : 1;
        int rank = Squares.rank(ep) + back;
        for (int df = -1; df <= 1; df += 2) {
            int f = Squares.file(ep) + df;
            if (!Squares.onBoard(f, rank)) continue;
            int from = Squares.of(f, rank);
            Piece pc = p.get(from);
            if (pc != null && pc.is(us, PieceType.PAWN)
                    && leavesKingSafe(p, new ChessMove(from, ep), us)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 格子 sq 是否被 by 方攻击。
     */
    public static boolean isAttacked(Position p, int sq, PieceColor by) {
        int f = Squares.file(sq);
        int r = Squares.rank(sq);

        // 兵：攻击方的兵位于 sq 的“后方”斜角
        int pawnRank = by == PieceColor.WHITE ? r - 1 : r + 1;
        for (int df = -1; df <= 1; df += 2) {
            if (Squares.onBoard(f + df, pawnRank)
                    && isPiece(p.get(Squares.of(f + df, pawnRank)), by, PieceType.PAWN)) {
                return true;
            }
        }
        for (int[] s : KNIGHT_STEPS) {
            if (Squares.onBoard(f + s[0], r + s[1])
                    && isPiece(p.get(Squares.of(f + s[0], r + s[1])), by, PieceType.KNIGHT)) {
                return true;
            }
        }
        for (int[] s : KING_STEPS) {
            if (Squares.onBoard(f + s[0], r + s[1])
                    && isPiece(p.get(Squares.of(f + s[0], r + s[1])), by, PieceType.KING)) {
                return true;
            }
        }
        return slidingAttack(p, f, r, by, ROOK_DIRS, PieceType.ROOK)
                || slidingAttack(p, f, r, by, BISHOP_DIRS, PieceType.BISHOP);
    }

    /**
     * 原始走子：不校验合法性，不记录重复键。
     * 调用方须保证 m 是当前局面的合法走法。
     */
    public static void play(Position p, ChessMove m) {
        Piece moving = p.get(m.from());
        Piece captured = p.get(m.to());
        PieceColor us = moving.color();
        boolean pawn = moving.type() == PieceType.PAWN;
        boolean enPassant = pawn && m.to() == p.epSquare() && captured == null
                && Squares.file(m.from()) != Squares.file(m.to());

        p.setHalfmoveClock(pawn || captured != null || enPassant ? 0 : p.halfmoveClock() + 1);

        p.set(m.from(), null);
        p.set(m.to(), m.promotion() != null ? new Piece(us, m.promotion()) : moving);

        if (enPassant) {
            int capturedSq = us == PieceColor.WHITE ? m.to() - 8 : m.to() + 8;
            p.set(capturedSq, null);
        }

        // 易位：王横移两格，同时移动车
        if (moving.type() == PieceType.KING && Math.abs(Squares.file(m.to()) - Squares.file(m.from())) == 2) {
            int rank = Squares.rank(m.from());
            boolean kingside = Squares.file(m.to()) > Squares.file(m.from());
            int rookFrom = Squares.of(kingside ? 7 : 0, rank);
            int rookTo = Squares.of(kingside ? 5 : 3, rank);
            p.set(rookTo, p.get(rookFrom));
            p.set(rookFrom, null);
        }

        p.setCastlingRights(p.castlingRights() & ~rightsLostBy(m.from()) & ~rightsLostBy(m.to()));

        if (pawn && Math.abs(m.to() - m.from()) == 16) {
            p.setEpSquare((m.from() + m.to()) / 2);
        } else {
            p.setEpSquare(Squares.NONE);
        }

        if (us == PieceColor.BLACK) {
            p.setFullmoveNumber(p.fullmoveNumber() + 1);
        }
        p.setTurn(us.opposite());
    }

    // ----------- private helpers -----------

    private static boolean leavesKingSafe(Position p, ChessMove m, PieceColor us) {
        Position next = p.copy();
        play(next, m);
        return !inCheck(next, us);
    }

    private static List<ChessMove> pseudoLegalMoves(Position p) {
        List<ChessMove> out = new ArrayList<>();
        PieceColor us = p.turn();
        for (int sq = 0; sq < 64; sq++) {
            Piece pc = p.get(sq);
            if (pc == null || pc.color() != us) continue;
            switch (pc.type()) {
                case PAWN -> pawnMoves(p, sq, us, out);
                case KNIGHT -> stepMoves(p, sq, us, KNIGHT_STEPS, out);
                case BISHOP -> slideMoves(p, sq, us, BISHOP_DIRS, out);
                case ROOK -> slideMoves(p, sq, us, ROOK_DIRS, out);
                case QUEEN -> {
                    slideMoves(p, sq, us, ROOK_DIRS, out);
                    slideMoves(p, sq, us, BISHOP_DIRS, out);
                }
                case KING -> {
                    stepMoves(p, sq, us, KING_STEPS, out);
                    castlingMoves(p, sq, us, out);
                }
            }
        }
        return out;
    }

    private static void pawnMoves(Position p, int sq, PieceColor us, List<ChessMove> out) {
        int f = Squares.file(sq);
        int r = Squares.rank(sq);
        int dir = us == PieceColor.WHITE ? 1 : -1;
        int startRank = us == PieceColor.WHITE ? 1 : 6;
        int lastRank = us == PieceColor.WHITE ? 7 : 0;

        int r1 = r + dir;
        if (!Squares.onBoard(f, r1)) return;
        int one = Squares.of(f, r1);
        if (p.get(one) == null) {
            addPawnMove(sq, one, r1 == lastRank, out);
            int two = Squares.of(f, r + 2 * dir);
            if (r == startRank && p.get(two) == null) {
                out.add(new ChessMove(sq, two));
            }
        }
        for (int df = -1; df <= 1; df += 2) {
            if (!Squares.onBoard(f + df, r1)) continue;
            int target = Squares.of(f + df, r1);
            Piece victim = p.get(target);
            if (victim != null && victim.color() != us) {
                addPawnMove(sq, target, r1 == lastRank, out);
            } else if (victim == null && target == p.epSquare()) {
                out.add(new ChessMove(sq, target));
            }
        }
    }

    private static void addPawnMove(int from, int to, boolean promotes, List<ChessMove> out) {
        if (!promotes) {
            out.add(new ChessMove(from, to));
            return;
        }
        for (PieceType t : PROMOTIONS) {
            out.add(new ChessMove(from, to, t));
        }
    }

    private static void stepMoves(Position p, int sq, PieceColor us, int[][] steps, List<ChessMove> out) {
        int f = Squares.file(sq);
        int r = Squares.rank(sq);
        for (int[] s : steps) {
            if (!Squares.onBoard(f + s[0], r + s[1])) continue;
            int to = Squares.of(f + s[0], r + s[1]);
            Piece target = p.get(to);
            if (target == null || target.color() != us) out.add(new ChessMove(sq, to));
        }
    }

    private static void slideMoves(Position p, int sq, PieceColor us, int[][] dirs, List<ChessMove> out) {
        for (int[] d : dirs) {
            int f = Squares.file(sq) + d[0];
            int r = Squares.rank(sq) + d[1];
            while (Squares.onBoard(f, r)) {
                int to = Squares.of(f, r);
                Piece target = p.get(to);
                if (target == null) {
                    out.add(new ChessMove(sq, to));
                } else {
                    if (target.color() != us) out.add(new ChessMove(sq, to));
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
    }

    private static void castlingMoves(Position p, int sq, PieceColor us, List<ChessMove> out) {
        int home = us == PieceColor.WHITE ? E1 : E8;
        if (sq != home) return;
        PieceColor them = us.opposite();
        if (isAttacked(p, sq, them)) return;
        int rank = Squares.rank(sq);
        int kingside = us == PieceColor.WHITE ? Position.WHITE_KINGSIDE : Position.BLACK_KINGSIDE;
        int queenside = us == PieceColor.WHITE ? Position.WHITE_QUEENSIDE : Position.BLACK_QUEENSIDE;

        if (p.hasCastlingRight(kingside)
                && isPiece(p.get(Squares.of(7, rank)), us, PieceType.ROOK)
                && p.get(Squares.of(5, rank)) == null && p.get(Squares.of(6, rank)) == null
                && !isAttacked(p, Squares.of(5, rank), them)
                && !isAttacked(p, Squares.of(6, rank), them)) {
            out.add(new ChessMove(sq, Squares.of(6, rank)));
        }
        if (p.hasCastlingRight(queenside)
                && isPiece(p.get(Squares.of(0, rank)), us, PieceType.ROOK)
                && p.get(Squares.of(1, rank)) == null && p.get(Squares.of(2, rank)) == null
                && p.get(Squares.of(3, rank)) == null
                && !isAttacked(p, Squares.of(3, rank), them)
                && !isAttacked(p, Squares.of(2, rank), them)) {
            out.add(new ChessMove(sq, Squares.of(2, rank)));
        }
    }

    private static boolean slidingAttack(Position p, int f0, int r0, PieceColor by, int[][] dirs, PieceType slider) {
        for (int[] d : dirs) {
            int f = f0 + d[0];
            int r = r0 + d[1];
            while (Squares.onBoard(f, r)) {
                Piece pc = p.get(Squares.of(f, r));
                if (pc != null) {
                    if (pc.color() == by && (pc.type() == slider || pc.type() == PieceType.QUEEN)) return true;
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
        return false;
    }

    /** 起点或终点触及王/车初始格时失去的易位权 */
    private static int rightsLostBy(int sq) {
        if (sq == E1) return Position.WHITE_KINGSIDE | Position.WHITE_QUEENSIDE;
        if (sq == E8) return Position.BLACK_KINGSIDE | Position.BLACK_QUEENSIDE;
        if (sq == H1) return Position.WHITE_KINGSIDE;
        if (sq == A1) return Position.WHITE_QUEENSIDE;
        if (sq == H8) return Position.BLACK_KINGSIDE;
        if (sq == A8) return Position.BLACK_QUEENSIDE;
        return 0;
    }

    private static boolean isPiece(Piece pc, PieceColor c, PieceType t) {
        return pc != null && pc.is(c, t);
    }
}
