package com.chesshub.chessservice.games.chess.domain.rule;

import java.util.List;
import java.util.Optional;

/**
 * 棋规能力（房间只通过它读写棋盘）。
 * 只包含规则判断与走子：合法性、落子、终局分类、序列化、走法解析。
 */
public interface RulesEngine {

    /** 新开一盘：标准初始局面 */
    Position newBoard();

    /** 当前行棋方的全部合法走法 */
    List<ChessMove> legalMoves(Position board);

    /** 走法在当前局面下是否合法 */
    boolean isLegal(Position board, ChessMove move);

    /**
     * 在给定棋盘上就地执行一步合法走法（不触碰其它共享状态）。
     *
     * @throws IllegalArgumentException 走法不合法
     */
    Position apply(Position board, ChessMove move);

    /**
     * 终局分类。优先级：将死 > 逼和 > 子力不足 > 三次重复 > 五十步 > 其它和棋。
     *
     * @return 终局时恰好一个 (result, reason)，否则 empty
     */
    Optional<Outcome> classifyTerminal(Position board);

    /** 局面序列化（FEN） */
    String serialize(Position board);

    /**
     * 解析坐标记法走法。
     *
     * @throws MoveParseException 格式不合法
     */
    ChessMove parseMove(String text);

    /** 当前行棋方 */
    PieceColor sideToMove(Position board);
}
