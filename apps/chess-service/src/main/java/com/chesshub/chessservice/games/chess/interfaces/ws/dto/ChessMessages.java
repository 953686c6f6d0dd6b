package com.chesshub.chessservice.games.chess.interfaces.ws.dto;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.Seat;
import com.chesshub.chessservice.games.chess.domain.enums.TerminalReason;
import com.chesshub.chessservice.games.chess.domain.rule.Outcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 *   1. 客户端 -> 服务端：{type:"move", move:"e2e4"}
 *   2. 服务端 -> 客户端：state（局面）/ error（仅发给出错的连接）
 */
public class ChessMessages {

    public static final String TYPE_STATE = "state";
    public static final String TYPE_MOVE = "move";
    public static final String TYPE_ERROR = "error";

    private ChessMessages() {
    }

    /**
     * 走子命令（客户端 → 服务端）。
     */
    @Data
    public static class MoveCmd {
        private String type;
        private String move;
    }

    /**
     * 局面推送（服务端 → 客户端）。
     * color 按接收者各自的座位填写；终局字段仅在终局时出现。
     */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StateMessage {
        private final String type = TYPE_STATE;
        private String fen;
        private Seat color;
        @JsonProperty("last_move")
        private String lastMove;
        @JsonProperty("game_over")
        private Boolean gameOver;
        private GameResult result;
        private TerminalReason reason;

        /** 连接建立时的初始局面 */
        public static StateMessage initial(String fen, Seat color) {
            StateMessage m = new StateMessage();
            m.setFen(fen);
            m.setColor(color);
            return m;
        }

        /** 每步走子后的局面 */
        public static StateMessage afterMove(String fen, Seat color, String lastMove, Outcome outcome) {
            StateMessage m = initial(fen, color);
            m.setLastMove(lastMove);
            if (outcome != null) {
                m.setGameOver(Boolean.TRUE);
                m.setResult(outcome.result());
                m.setReason(outcome.reason());
            }
            return m;
        }
    }

    /**
     * 错误提示（仅发给出错连接）。
     */
    @Data
    public static class ErrorMessage {
        private final String type = TYPE_ERROR;
        private final String message;
    }
}
