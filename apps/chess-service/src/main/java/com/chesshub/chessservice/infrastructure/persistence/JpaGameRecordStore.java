package com.chesshub.chessservice.infrastructure.persistence;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.TerminalReason;
import com.chesshub.chessservice.games.chess.domain.model.GameRecord;
import com.chesshub.chessservice.games.chess.domain.repository.GameRecordStore;
import com.chesshub.chessservice.infrastructure.persistence.entity.GameRecordEntity;
import com.chesshub.chessservice.infrastructure.persistence.repository.GameRecordRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;

/**
 * GameRecordStore 的 JPA 实现。
 */
@Component
@RequiredArgsConstructor
public class JpaGameRecordStore implements GameRecordStore {

    private final GameRecordRepository repository;

    @Override
    @Transactional
    public GameRecord insertGame(GameRecord record) {
        GameRecordEntity saved = repository.save(GameRecordEntity.builder()
                .roomId(record.roomId())
                .whiteId(record.whiteUserId())
                .blackId(record.blackUserId())
                .result(record.result().code())
                .reason(record.reason() == null ? null : record.reason().code())
                .moves(record.movesText())
                .createdAt(record.createdAt())
                .finishedAt(record.finishedAt())
                .build());
        return toRecord(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GameRecord> findRecent(Long userId, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<GameRecordEntity> rows = userId == null
                ? repository.findRecent(page)
                : repository.findRecentByParticipant(userId, page);
        return rows.stream().map(JpaGameRecordStore::toRecord).toList();
    }

    static GameRecord toRecord(GameRecordEntity e) {
        List<String> moves = StringUtils.isBlank(e.getMoves())
                ? List.of()
                : Arrays.asList(StringUtils.split(e.getMoves(), ' '));
        return GameRecord.builder()
                .id(e.getId())
                .roomId(e.getRoomId())
                .whiteUserId(e.getWhiteId())
                .blackUserId(e.getBlackId())
                .result(GameResult.fromCode(e.getResult()))
                .reason(e.getReason() == null ? null : TerminalReason.fromCode(e.getReason()))
                .moves(moves)
                .createdAt(e.getCreatedAt())
                .finishedAt(e.getFinishedAt())
                .build();
    }
}
