package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * FEN 编解码。
 * <pre>
 *   rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1
 * </pre>
 * 过路兵字段只在存在合法吃过路兵时输出，保证同一局面序列化结果唯一。
 */
public final class FenCodec {

    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private FenCodec() {
    }

    /** 局面 -> 完整 FEN */
    public static String toFen(Position p) {
        return repetitionKey(p) + " " + p.halfmoveClock() + " " + p.fullmoveNumber();
    }

    /**
     * 重复局面判定用的键：FEN 前四段（不含半回合/回合计数）。
     */
    public static String repetitionKey(Position p) {
        StringBuilder sb = new StringBuilder(64);
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                Piece pc = p.get(Squares.of(file, rank));
                if (pc == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(pc.fenChar());
            }
            if (empty > 0) sb.append(empty);
            if (rank > 0) sb.append('/');
        }
        sb.append(' ').append(p.turn().fen()).append(' ');

        int before = sb.length();
        if (p.hasCastlingRight(Position.WHITE_KINGSIDE)) sb.append('K');
        if (p.hasCastlingRight(Position.WHITE_QUEENSIDE)) sb.append('Q');
        if (p.hasCastlingRight(Position.BLACK_KINGSIDE)) sb.append('k');
        if (p.hasCastlingRight(Position.BLACK_QUEENSIDE)) sb.append('q');
        if (sb.length() == before) sb.append('-');

        sb.append(' ');
        sb.append(MoveGenerator.hasLegalEnPassant(p) ? Squares.name(p.epSquare()) : "-");
        return sb.toString();
    }

    /**
     * FEN -> 局面（并登记初始重复键）。
     *
     * @throws IllegalArgumentException FEN 格式不合法
     */
    public static Position fromFen(String fen) {
        if (fen == null) throw new IllegalArgumentException("INVALID_FEN: null");
        String[] parts = fen.trim().split("\\s+");
        if (parts.length < 4) throw new IllegalArgumentException("INVALID_FEN: " + fen);

        Position p = new Position();
        String[] rows = parts[0].split("/");
        if (rows.length != 8) throw new IllegalArgumentException("INVALID_FEN: " + fen);
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : rows[i].toCharArray()) {
                if (Character.isDigit(c)) {
                    file += c - '0';
                    continue;
                }
                Piece pc = Piece.fromFen(c);
                if (pc == null || file > 7) throw new IllegalArgumentException("INVALID_FEN: " + fen);
                p.set(Squares.of(file, rank), pc);
                file++;
            }
            if (file != 8) throw new IllegalArgumentException("INVALID_FEN: " + fen);
        }

        switch (parts[1]) {
            case "w" -> p.setTurn(PieceColor.WHITE);
            case "b" -> p.setTurn(PieceColor.BLACK);
            default -> throw new IllegalArgumentException("INVALID_FEN: " + fen);
        }

        int rights = 0;
        for (char c : parts[2].toCharArray()) {
            switch (c) {
                case 'K' -> rights |= Position.WHITE_KINGSIDE;
                case 'Q' -> rights |= Position.WHITE_QUEENSIDE;
                case 'k' -> rights |= Position.BLACK_KINGSIDE;
                case 'q' -> rights |= Position.BLACK_QUEENSIDE;
                case '-' -> { }
                default -> throw new IllegalArgumentException("INVALID_FEN: " + fen);
            }
        }
        p.setCastlingRights(rights);
        p.setEpSquare("-".equals(parts[3]) ? Squares.NONE : Squares.parse(parts[3]));

        try {
            if (parts.length > 4) p.setHalfmoveClock(Integer.parseInt(parts[4]));
            if (parts.length > 5) p.setFullmoveNumber(Integer.parseInt(parts[5]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("INVALID_FEN: " + fen, e);
        }

        p.recordRepetitionKey(repetitionKey(p));
        return p;
    }
}
