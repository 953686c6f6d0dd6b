package com.chesshub.chessservice.games.chess.domain.rule;

import com.chesshub.chessservice.games.chess.domain.enums.TerminalReason;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 标准国际象棋规则。
 * <p>
 * 自动终局条件：将死、逼和、子力不足、五次重复、七十五步；
 * 终局原因按 {@link RulesEngine#classifyTerminal} 的优先级给出
 * （五次重复必然满足三次重复，七十五步必然满足五十步）。
 */
@Component
public class StandardChessRules implements RulesEngine {

    /** 自动判和的重复次数 */
    static final int FIVEFOLD = 5;
    static final int THREEFOLD = 3;
    /** 半回合计数：50 步 = 100 个半回合，75 步 = 150 个半回合 */
    static final int FIFTY_MOVES = 100;
    static final int SEVENTY_FIVE_MOVES = 150;

    @Override
    public Position newBoard() {
        return FenCodec.fromFen(FenCodec.START_FEN);
    }

    @Override
    public List<ChessMove> legalMoves(Position board) {
        return MoveGenerator.legalMoves(board);
    }

    @Override
    public boolean isLegal(Position board, ChessMove move) {
        if (move == null) return false;
        Piece pc = board.get(move.from());
        if (pc == null || pc.color() != board.turn()) return false;
        return MoveGenerator.legalMoves(board).contains(standardCastling(board, move));
    }

    @Override
    public Position apply(Position board, ChessMove move) {
        if (!isLegal(board, move)) {
            throw new IllegalArgumentException("ILLEGAL_MOVE: " + move);
        }
        MoveGenerator.play(board, standardCastling(board, move));
        board.recordRepetitionKey(FenCodec.repetitionKey(board));
        return board;
    }

    @Override
    public Optional<Outcome> classifyTerminal(Position board) {
        PieceColor toMove = board.turn();
        boolean noMoves = MoveGenerator.legalMoves(board).isEmpty();
        boolean check = MoveGenerator.inCheck(board, toMove);

        if (noMoves && check) return Optional.of(Outcome.checkmate(toMove));
        if (noMoves) return Optional.of(Outcome.draw(TerminalReason.STALEMATE));
        if (isInsufficientMaterial(board)) return Optional.of(Outcome.draw(TerminalReason.INSUFFICIENT_MATERIAL));

        int repetitions = board.currentRepetitionCount();
        boolean automaticDraw = repetitions >= FIVEFOLD || board.halfmoveClock() >= SEVENTY_FIVE_MOVES;
        if (!automaticDraw) return Optional.empty();

        if (canClaimThreefold(board)) return Optional.of(Outcome.draw(TerminalReason.THREEFOLD_REPETITION));
        if (board.halfmoveClock() >= FIFTY_MOVES) return Optional.of(Outcome.draw(TerminalReason.FIFTY_MOVE_RULE));
        return Optional.of(Outcome.draw(TerminalReason.DRAW));
    }

    @Override
    public String serialize(Position board) {
        return FenCodec.toFen(board);
    }

    @Override
    public ChessMove parseMove(String text) {
        return ChessMove.fromUci(text);
    }

    @Override
    public PieceColor sideToMove(Position board) {
        return board.turn();
    }

    /**
     * 可申请三次重复：当前局面已出现三次，或存在一步合法着法使走后局面第三次出现。
     */
    private static boolean canClaimThreefold(Position board) {
        if (board.currentRepetitionCount() >= THREEFOLD) return true;
        for (ChessMove m : MoveGenerator.legalMoves(board)) {
            Position next = board.copy();
            MoveGenerator.play(next, m);
            next.recordRepetitionKey(FenCodec.repetitionKey(next));
            if (next.currentRepetitionCount() >= THREEFOLD) return true;
        }
        return false;
    }

    /**
     * 王吃己方车的易位写法（e1h1 / e1a1 / e8h8 / e8a8）换成标准写法（e1g1 / e1c1 ...）；
     * 其它着法原样返回。
     */
    private static ChessMove standardCastling(Position board, ChessMove move) {
        Piece king = board.get(move.from());
        Piece rook = board.get(move.to());
        if (king == null || rook == null || move.promotion() != null) return move;
        if (king.type() != PieceType.KING || !rook.is(king.color(), PieceType.ROOK)) return move;
        int rank = Squares.rank(move.from());
        if (Squares.file(move.from()) != 4 || Squares.rank(move.to()) != rank) return move;
        return switch (Squares.file(move.to())) {
            case 7 -> new ChessMove(move.from(), Squares.of(6, rank));
            case 0 -> new ChessMove(move.from(), Squares.of(2, rank));
            default -> move;
        };
    }

    /**
     * 子力不足：双方都无法将死对方。
     * 王对王、王+单轻子对王、只剩同色格象。
     */
    static boolean isInsufficientMaterial(Position board) {
        List<Integer> minorSquares = new ArrayList<>();
        boolean knights = false;
        for (int sq = 0; sq < 64; sq++) {
            Piece pc = board.get(sq);
            if (pc == null || pc.type() == PieceType.KING) continue;
            switch (pc.type()) {
                case PAWN, ROOK, QUEEN -> {
                    return false;
                }
                case KNIGHT -> knights = true;
                default -> { }
            }
            minorSquares.add(sq);
        }
        if (minorSquares.size() <= 1) return true;
        if (knights) return false;
        boolean light = Squares.isLight(minorSquares.get(0));
        return minorSquares.stream().allMatch(sq -> Squares.isLight(sq) == light);
    }
}
