package com.chesshub.chessservice.games.chess.interfaces.http.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 单个房间详情：摘要 + 当前局面 + 走子历史。
 */
@Data
@AllArgsConstructor
public class RoomDetail {
    private RoomSummary summary;
    private String fen;
    private List<String> moves;
}
