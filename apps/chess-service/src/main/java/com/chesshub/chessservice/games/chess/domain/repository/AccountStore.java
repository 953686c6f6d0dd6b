package com.chesshub.chessservice.games.chess.domain.repository;

import com.chesshub.chessservice.games.chess.domain.model.UserRating;

import java.util.Optional;

/**
 * 账号评分存取。
 * 调用方需处于事务中：getUser 会对该行加写锁，直到事务结束。
 */
public interface AccountStore {

    Optional<UserRating> getUser(Long userId);

    void updateUser(Long userId, UserRating rating);
}
