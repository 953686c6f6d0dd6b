package com.chesshub.chessservice.games.chess.service;

import com.chesshub.chessservice.games.chess.domain.model.GameRecord;
import com.chesshub.chessservice.games.chess.domain.model.UserRating;
import com.chesshub.chessservice.games.chess.domain.rating.EloRatingEngine;
import com.chesshub.chessservice.games.chess.domain.rating.RatingUpdate;
import com.chesshub.chessservice.games.chess.domain.repository.AccountStore;
import com.chesshub.chessservice.games.chess.domain.repository.GameRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * 终局结算：写对局记录 + 更新双方等级分，同一事务内完成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameFinalizer {

    private final GameRecordStore recordStore;
    private final AccountStore accountStore;
    private final EloRatingEngine ratingEngine;

    /**
     * 记录总会写入；只有双方账号都已知且都存在时才更新评分。
     *
     * @return 已落库的记录
     */
    @Transactional
    public GameRecord finalizeGame(GameRecord record) {
        GameRecord saved = recordStore.insertGame(record);

        Long whiteId = record.whiteUserId();
        Long blackId = record.blackUserId();
        if (whiteId == null || blackId == null) {
            log.info("缺少参赛账号，跳过评分: roomId={}, white={}, black={}", record.roomId(), whiteId, blackId);
            return saved;
        }
        if (Objects.equals(whiteId, blackId)) {
            log.info("同一账号执双色，跳过评分: roomId={}, userId={}", record.roomId(), whiteId);
            return saved;
        }

        // 按 id 升序加锁，避免两局交叉结算时互相等待
        Optional<UserRating> white;
        Optional<UserRating> black;
        if (whiteId < blackId) {
            white = accountStore.getUser(whiteId);
            black = accountStore.getUser(blackId);
        } else {
            black = accountStore.getUser(blackId);
            white = accountStore.getUser(whiteId);
        }
        if (white.isEmpty() || black.isEmpty()) {
            log.warn("参赛账号不存在，跳过评分: roomId={}, white={}, black={}", record.roomId(), whiteId, blackId);
            return saved;
        }

        RatingUpdate update = ratingEngine.rate(white.get(), black.get(), record.result());
        accountStore.updateUser(whiteId, update.white());
        accountStore.updateUser(blackId, update.black());

        log.info("评分已更新: roomId={}, white={} {}->{}, black={} {}->{}",
                record.roomId(),
                whiteId, white.get().rating(), update.white().rating(),
                blackId, black.get().rating(), update.black().rating());
        return saved;
    }
}
