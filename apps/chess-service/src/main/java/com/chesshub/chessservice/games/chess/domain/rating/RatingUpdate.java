package com.chesshub.chessservice.games.chess.domain.rating;

import com.chesshub.chessservice.games.chess.domain.model.UserRating;

/** 一局结算后双方的新评分 */
public record RatingUpdate(UserRating white, UserRating black) {
}
