package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * 一步棋（坐标记法 / UCI）：起点 + 终点 + 可选升变兵种。
 * 例如 "e2e4"、"e7e8q"。
 */
public record ChessMove(int from, int to, PieceType promotion) {

    public ChessMove(int from, int to) {
        this(from, to, null);
    }

    public String uci() {
        String s = Squares.name(from) + Squares.name(to);
        return promotion == null ? s : s + promotion.symbol();
    }

    /**
     * 解析坐标记法。只做格式校验，不判断合法性。
     *
     * @throws MoveParseException 格式不合法
     */
    public static ChessMove fromUci(String text) {
        if (text == null) throw new MoveParseException("null");
        String t = text.trim();
        if (t.length() != 4 && t.length() != 5) throw new MoveParseException(text);
        int from = Squares.parse(t.substring(0, 2));
        int to = Squares.parse(t.substring(2, 4));
        if (from == Squares.NONE || to == Squares.NONE || from == to) {
            throw new MoveParseException(text);
        }
        PieceType promo = null;
        if (t.length() == 5) {
            char c = t.charAt(4);
            promo = Character.isLowerCase(c) ? PieceType.fromSymbol(c) : null;
            if (promo == null || !promo.isPromotionTarget()) throw new MoveParseException(text);
        }
        return new ChessMove(from, to, promo);
    }

    @Override
    public String toString() {
        return uci();
    }
}
