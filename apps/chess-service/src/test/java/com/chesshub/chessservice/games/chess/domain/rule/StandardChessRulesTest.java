package com.chesshub.chessservice.games.chess.domain.rule;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.TerminalReason;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardChessRulesTest {

    private final StandardChessRules rules = new StandardChessRules();

    private Position play(Position board, String... moves) {
        for (String m : moves) {
            rules.apply(board, rules.parseMove(m));
        }
        return board;
    }

    @Test
    void newBoardIsStandardStartingPosition() {
        Position board = rules.newBoard();

        assertThat(rules.serialize(board)).isEqualTo(FenCodec.START_FEN);
        assertThat(rules.legalMoves(board)).hasSize(20);
        assertThat(rules.sideToMove(board)).isEqualTo(PieceColor.WHITE);
        assertThat(rules.classifyTerminal(board)).isEmpty();
    }

    @Test
    void doublePawnPushWithoutCaptureOmitsEnPassantSquare() {
        Position board = play(rules.newBoard(), "e2e4");

        assertThat(rules.serialize(board))
                .isEqualTo("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq - 0 1");
        assertThat(rules.sideToMove(board)).isEqualTo(PieceColor.BLACK);
    }

    @Test
    void scholarsMateIsWhiteCheckmate() {
        Position board = play(rules.newBoard(), "e2e4", "e7e5", "f1c4", "b8c6", "d1h5", "g8f6", "h5f7");

        Optional<Outcome> outcome = rules.classifyTerminal(board);

        assertThat(outcome).contains(new Outcome(GameResult.WHITE, TerminalReason.CHECKMATE));
        assertThat(rules.legalMoves(board)).isEmpty();
    }

    @Test
    void foolsMateIsBlackCheckmate() {
        Position board = play(rules.newBoard(), "f2f3", "e7e5", "g2g4", "d8h4");

        assertThat(rules.classifyTerminal(board)).contains(Outcome.checkmate(PieceColor.WHITE));
        assertThat(Outcome.checkmate(PieceColor.WHITE).result()).isEqualTo(GameResult.BLACK);
    }

    @Test
    void stalemateIsDraw() {
        Position board = play(FenCodec.fromFen("7k/8/6K1/8/8/8/8/5Q2 w - - 0 1"), "f1f7");

        assertThat(rules.classifyTerminal(board)).contains(Outcome.draw(TerminalReason.STALEMATE));
    }

    @Test
    void insufficientMaterialDetection() {
        assertThat(StandardChessRules.isInsufficientMaterial(FenCodec.fromFen("8/8/8/4k3/8/8/8/4K3 w - - 0 1"))).isTrue();
        assertThat(StandardChessRules.isInsufficientMaterial(FenCodec.fromFen("8/8/8/4k3/8/8/8/4K2N w - - 0 1"))).isTrue();
        // 同为暗格的两只象
        assertThat(StandardChessRules.isInsufficientMaterial(FenCodec.fromFen("5b2/8/8/4k3/8/8/8/2B1K3 w - - 0 1"))).isTrue();
        assertThat(StandardChessRules.isInsufficientMaterial(FenCodec.fromFen("5n2/8/8/4k3/8/8/8/2B1K3 w - - 0 1"))).isFalse();
        assertThat(StandardChessRules.isInsufficientMaterial(FenCodec.fromFen("8/8/8/4k3/8/8/4P3/4K3 w - - 0 1"))).isFalse();

        Position board = play(FenCodec.fromFen("8/8/8/4k3/8/8/3r4/4K3 w - - 0 1"), "e1d2");
        assertThat(rules.classifyTerminal(board)).contains(Outcome.draw(TerminalReason.INSUFFICIENT_MATERIAL));
    }

    @Test
    void castlingMovesRookAndDropsRights() {
        Position board = FenCodec.fromFen("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        play(board, "e1g1");

        assertThat(rules.serialize(board)).isEqualTo("r3k2r/8/8/8/8/8/8/R4RK1 b kq - 1 1");
    }

    @Test
    void cannotCastleThroughAttackedSquare() {
        Position board = FenCodec.fromFen("r3k2r/8/8/8/8/8/5r2/R3K2R w KQkq - 0 1");

        assertThat(rules.isLegal(board, rules.parseMove("e1g1"))).isFalse();
        assertThat(rules.isLegal(board, rules.parseMove("e1c1"))).isTrue();
    }

    @Test
    void kingTakesOwnRookIsAcceptedAsCastling() {
        Position kingside = FenCodec.fromFen("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");
        assertThat(rules.isLegal(kingside, rules.parseMove("e1h1"))).isTrue();
        play(kingside, "e1h1");
        assertThat(rules.serialize(kingside)).isEqualTo("r3k2r/8/8/8/8/8/8/R4RK1 b kq - 1 1");

        play(kingside, "e8a8");
        assertThat(rules.serialize(kingside)).isEqualTo("2kr3r/8/8/8/8/8/8/R4RK1 w - - 2 2");

        // 没有易位权时王吃己方车仍然非法
        Position noRights = FenCodec.fromFen("r3k2r/8/8/8/8/8/8/R3K2R w - - 0 1");
        assertThat(rules.isLegal(noRights, rules.parseMove("e1h1"))).isFalse();
    }

    @Test
    void enPassantCaptureRemovesPawnAndFenShowsTarget() {
        Position board = play(FenCodec.fromFen("4k3/3p4/8/4P3/8/8/8/4K3 b - - 0 1"), "d7d5");
        assertThat(rules.serialize(board)).isEqualTo("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 2");

        play(board, "e5d6");

        assertThat(rules.serialize(board)).isEqualTo("4k3/8/3P4/8/8/8/8/4K3 b - - 0 2");
    }

    @Test
    void promotionRequiresExplicitPiece() {
        Position board = FenCodec.fromFen("8/4P3/8/8/8/k7/8/4K3 w - - 0 1");

        assertThat(rules.isLegal(board, rules.parseMove("e7e8"))).isFalse();
        assertThat(rules.isLegal(board, rules.parseMove("e7e8n"))).isTrue();

        play(board, "e7e8q");
        assertThat(rules.serialize(board)).startsWith("4Q3/");
    }

    @Test
    void moveLeavingKingInCheckIsIllegal() {
        // e 线被车钉住的象不能离开
        Position board = FenCodec.fromFen("4r1k1/8/8/8/8/8/4B3/4K3 w - - 0 1");

        assertThat(rules.isLegal(board, rules.parseMove("e2d3"))).isFalse();
        assertThat(rules.isLegal(board, rules.parseMove("e1d1"))).isTrue();
    }

    @Test
    void applyRejectsIllegalMoveWithoutMutation() {
        Position board = rules.newBoard();

        assertThatThrownBy(() -> rules.apply(board, rules.parseMove("e2e5")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(rules.serialize(board)).isEqualTo(FenCodec.START_FEN);
    }

    @Test
    void malformedMoveTextIsRejected() {
        assertThatThrownBy(() -> rules.parseMove("e2e9")).isInstanceOf(MoveParseException.class);
        assertThatThrownBy(() -> rules.parseMove("e7e8Q")).isInstanceOf(MoveParseException.class);
        assertThatThrownBy(() -> rules.parseMove("e7e8k")).isInstanceOf(MoveParseException.class);
        assertThatThrownBy(() -> rules.parseMove("hello")).isInstanceOf(MoveParseException.class);
        assertThatThrownBy(() -> rules.parseMove(null)).isInstanceOf(MoveParseException.class);
    }

    @Test
    void threefoldAloneDoesNotEndGameButFivefoldDoes() {
        String[] cycle = {"g1f3", "g8f6", "f3g1", "f6g8"};
        Position board = rules.newBoard();

        play(board, cycle);
        play(board, cycle);
        assertThat(board.currentRepetitionCount()).isEqualTo(3);
        assertThat(rules.classifyTerminal(board)).isEmpty();

        play(board, cycle);
        play(board, cycle);
        assertThat(board.currentRepetitionCount()).isEqualTo(5);
        assertThat(rules.classifyTerminal(board)).contains(Outcome.draw(TerminalReason.THREEFOLD_REPETITION));
    }

    @Test
    void seventyFiveMoveRuleEndsGameAsFiftyMoveDraw() {
        Position fifty = play(FenCodec.fromFen("4k3/8/8/8/8/8/8/R3K3 w - - 99 60"), "a1a2");
        assertThat(fifty.halfmoveClock()).isEqualTo(100);
        assertThat(rules.classifyTerminal(fifty)).isEmpty();

        Position seventyFive = play(FenCodec.fromFen("4k3/8/8/8/8/8/8/R3K3 w - - 149 80"), "a1a2");
        assertThat(rules.classifyTerminal(seventyFive)).contains(Outcome.draw(TerminalReason.FIFTY_MOVE_RULE));
    }

    @Test
    void seventyFiveMoveEndReportsThreefoldWhenNextMoveRepeatsThirdTime() {
        Position board = FenCodec.fromFen("7k/8/8/8/8/8/8/R6K w - - 143 100");

        play(board, "a1a2", "h8g8", "a2a1", "g8h8", "a1a2", "h8g8");
        assertThat(rules.classifyTerminal(board)).isEmpty();

        // 黑方 g8h8 即可第三次回到起始局面
        play(board, "a2a1");
        assertThat(board.halfmoveClock()).isEqualTo(150);
        assertThat(board.currentRepetitionCount()).isEqualTo(2);
        assertThat(rules.classifyTerminal(board)).contains(Outcome.draw(TerminalReason.THREEFOLD_REPETITION));
    }

    @Test
    void invalidFenIsRejected() {
        assertThatThrownBy(() -> FenCodec.fromFen("not a fen")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FenCodec.fromFen("8/8/8 w - - 0 1")).isInstanceOf(IllegalArgumentException.class);
    }
}
