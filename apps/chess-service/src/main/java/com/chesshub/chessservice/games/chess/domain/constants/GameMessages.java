package com.chesshub.chessservice.games.chess.domain.constants;

/**
 * 对局协议中发给客户端的错误提示常量。
 * 客户端依赖这些文本，修改前需同步前端。
 */
public final class GameMessages {

    private GameMessages() {
    }

    // ========== 走子 ==========

    /** 对局已结束 */
    public static final String GAME_ALREADY_OVER = "Game is already over";

    /** 观战者尝试走子 */
    public static final String SPECTATOR_CANNOT_MOVE = "Spectators cannot make moves";

    /** 未轮到该方 */
    public static final String NOT_YOUR_TURN = "It is not your turn";

    /** 无法解析或不合法的走法 */
    public static final String INVALID_MOVE = "Invalid move";

    // ========== 协议 ==========

    public static final String MALFORMED_MESSAGE = "Malformed message";

    public static final String UNSUPPORTED_MESSAGE_TYPE = "Unsupported message type";
}
