package com.chesshub.chessservice.games.chess.domain.repository;

import com.chesshub.chessservice.games.chess.domain.model.GameRecord;

import java.util.List;

/**
 * 对局记录存储（只追加）。
 */
public interface GameRecordStore {

    /** 写入一条记录，返回带 id 的记录 */
    GameRecord insertGame(GameRecord record);

    /**
     * 最近结束的对局，按结束时间倒序。
     *
     * @param userId 参赛账号过滤；null 表示不过滤
     * @param limit  最多返回条数
     */
    List<GameRecord> findRecent(Long userId, int limit);
}
