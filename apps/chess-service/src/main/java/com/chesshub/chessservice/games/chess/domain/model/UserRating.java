package com.chesshub.chessservice.games.chess.domain.model;

/**
 * 账号的等级分与胜负统计。
 */
public record UserRating(int rating, int wins, int losses, int draws) {
}
