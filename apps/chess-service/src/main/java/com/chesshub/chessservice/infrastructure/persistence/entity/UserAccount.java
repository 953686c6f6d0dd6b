package com.chesshub.chessservice.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * 账号表实体
 * 对应数据库表：users
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    /**
     * 用户名（唯一）
     */
    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    /**
     * 密码哈希（BCrypt）
     */
    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    /**
     * 等级分
     */
    @Column(name = "rating", nullable = false)
    @Builder.Default
    private Integer rating = 1200;

    @Column(name = "wins", nullable = false)
    @Builder.Default
    private Integer wins = 0;

    @Column(name = "losses", nullable = false)
    @Builder.Default
    private Integer losses = 0;

    @Column(name = "draws", nullable = false)
    @Builder.Default
    private Integer draws = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
