package com.chesshub.chessservice.games.chess.service;

import com.chesshub.chessservice.games.chess.domain.enums.SeatPreference;
import com.chesshub.chessservice.platform.ws.PlayerConnection;

/**
 * 对局房间的连接生命周期与指令处理。
 */
public interface ChessRoomService {

    /** 连接进入房间：分配座位、登记连接、推送初始局面 */
    CommandResult join(String roomId, PlayerConnection connection, SeatPreference preference);

    /** 处理一条原始文本消息（JSON） */
    CommandResult handleMessage(String roomId, String connectionId, String payload);

    /** 处理走子 */
    CommandResult handleMove(String roomId, String connectionId, String moveText);

    /** 连接断开：释放座位、注销连接，房间继续存在 */
    void leave(String roomId, String connectionId);
}
