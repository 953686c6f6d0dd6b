package com.chesshub.chessservice.infrastructure.persistence.repository;

import com.chesshub.chessservice.infrastructure.persistence.entity.GameRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 对局记录 Repository
 */
@Repository
public interface GameRecordRepository extends JpaRepository<GameRecordEntity, Long> {

    /**
     * 最近结束的对局
     */
    @Query("SELECT g FROM GameRecordEntity g ORDER BY g.finishedAt DESC, g.id DESC")
    List<GameRecordEntity> findRecent(Pageable pageable);

    /**
     * 某账号参与的最近对局（执白或执黑）
     */
    @Query("SELECT g FROM GameRecordEntity g WHERE g.whiteId = :userId OR g.blackId = :userId " +
            "ORDER BY g.finishedAt DESC, g.id DESC")
    List<GameRecordEntity> findRecentByParticipant(@Param("userId") Long userId, Pageable pageable);
}
