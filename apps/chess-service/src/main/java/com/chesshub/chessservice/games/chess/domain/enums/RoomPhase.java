package com.chesshub.chessservice.games.chess.domain.enums;

public enum RoomPhase {

    WAITING,   // 等待入座（白/黑未坐满且尚未走子）
    ACTIVE,    // 对局中（双方已入座，或已有走子）
    FINISHED   // 已终局（不可逆）
}
