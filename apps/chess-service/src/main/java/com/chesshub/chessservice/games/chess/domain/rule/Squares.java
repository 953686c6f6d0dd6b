package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * 格子编号工具：index = rank * 8 + file，a1 = 0，h8 = 63。
 */
public final class Squares {

    public static final int NONE = -1;

    private Squares() {
    }

    public static int of(int file, int rank) {
        return rank * 8 + file;
    }

    public static int file(int sq) {
        return sq & 7;
    }

    public static int rank(int sq) {
        return sq >> 3;
    }

    public static boolean onBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    /** 格子名，例如 0 -> "a1" */
    public static String name(int sq) {
        return "" + (char) ('a' + file(sq)) + (char) ('1' + rank(sq));
    }

    /** 解析格子名；非法返回 {@link #NONE} */
    public static int parse(String name) {
        if (name == null || name.length() != 2) return NONE;
        int f = name.charAt(0) - 'a';
        int r = name.charAt(1) - '1';
        return onBoard(f, r) ? of(f, r) : NONE;
    }

    /** 是否为浅色格（用于判断同色象） */
    public static boolean isLight(int sq) {
        return ((file(sq) + rank(sq)) & 1) == 1;
    }
}
