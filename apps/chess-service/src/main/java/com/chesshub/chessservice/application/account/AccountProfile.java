package com.chesshub.chessservice.application.account;

import com.chesshub.chessservice.infrastructure.persistence.entity.UserAccount;
import lombok.Builder;

/**
 * 账号公开信息（等级分与战绩）。
 */
@Builder
public record AccountProfile(Long userId, String username, int rating, int wins, int losses, int draws) {

    public static AccountProfile from(UserAccount a) {
        return AccountProfile.builder()
                .userId(a.getId())
                .username(a.getUsername())
                .rating(a.getRating())
                .wins(a.getWins())
                .losses(a.getLosses())
                .draws(a.getDraws())
                .build();
    }
}
