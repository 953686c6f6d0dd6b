package com.chesshub.chessservice.games.chess.domain.rating;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.model.UserRating;

/**
 * Elo 评分计算（纯函数，无 IO）。
 * <pre>
 *   E(w) = 1 / (1 + 10^((Rb - Rw) / 400))
 *   R'   = max(floor, round(R + K * (S - E)))
 * </pre>
 */
public class EloRatingEngine {

    public static final int DEFAULT_K = 32;
    public static final int DEFAULT_FLOOR = 100;

    private final int kFactor;
    private final int floor;

    public EloRatingEngine() {
        this(DEFAULT_K, DEFAULT_FLOOR);
    }

    public EloRatingEngine(int kFactor, int floor) {
        this.kFactor = kFactor;
        this.floor = floor;
    }

    public RatingUpdate rate(UserRating white, UserRating black, GameResult result) {
        double expectedWhite = expected(white.rating(), black.rating());
        double expectedBlack = expected(black.rating(), white.rating());

        double scoreWhite;
        double scoreBlack;
        switch (result) {
            case WHITE -> { scoreWhite = 1.0; scoreBlack = 0.0; }
            case BLACK -> { scoreWhite = 0.0; scoreBlack = 1.0; }
            default -> { scoreWhite = 0.5; scoreBlack = 0.5; }
        }

        int newWhite = adjust(white.rating(), scoreWhite, expectedWhite);
        int newBlack = adjust(black.rating(), scoreBlack, expectedBlack);

        return new RatingUpdate(
                tally(white, newWhite, result, GameResult.WHITE),
                tally(black, newBlack, result, GameResult.BLACK));
    }

    /** self 对 opponent 的期望得分 */
    static double expected(int self, int opponent) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponent - self) / 400.0));
    }

    private int adjust(int rating, double score, double expected) {
        return (int) Math.max(floor, Math.round(rating + kFactor * (score - expected)));
    }

    private static UserRating tally(UserRating before, int rating, GameResult result, GameResult winIf) {
        if (result == GameResult.DRAW) {
            return new UserRating(rating, before.wins(), before.losses(), before.draws() + 1);
        }
        if (result == winIf) {
            return new UserRating(rating, before.wins() + 1, before.losses(), before.draws());
        }
        return new UserRating(rating, before.wins(), before.losses() + 1, before.draws());
    }
}
