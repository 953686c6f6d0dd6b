package com.chesshub.chessservice.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 对局记录实体
 * 对应数据库表：games（只插入，不更新）
 */
@Entity
@Table(name = "games", indexes = {
        @Index(name = "idx_games_white", columnList = "white_id"),
        @Index(name = "idx_games_black", columnList = "black_id"),
        @Index(name = "idx_games_finished_at", columnList = "finished_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 100, updatable = false)
    private String roomId;

    /** 白方账号，可为空（匿名入座） */
    @Column(name = "white_id", updatable = false)
    private Long whiteId;

    @Column(name = "black_id", updatable = false)
    private Long blackId;

    /** white / black / draw */
    @Column(name = "result", nullable = false, length = 10, updatable = false)
    private String result;

    @Column(name = "reason", length = 40, updatable = false)
    private String reason;

    /** UCI 走子序列，空格分隔 */
    @Column(name = "moves", nullable = false, length = 8192, updatable = false)
    private String moves;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt;
}
