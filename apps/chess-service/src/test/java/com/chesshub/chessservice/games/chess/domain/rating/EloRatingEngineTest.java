package com.chesshub.chessservice.games.chess.domain.rating;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.model.UserRating;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EloRatingEngineTest {

    private final EloRatingEngine engine = new EloRatingEngine();

    @Test
    void equalRatingsWhiteWins() {
        RatingUpdate u = engine.rate(new UserRating(1200, 0, 0, 0), new UserRating(1200, 0, 0, 0), GameResult.WHITE);

        assertThat(u.white()).isEqualTo(new UserRating(1216, 1, 0, 0));
        assertThat(u.black()).isEqualTo(new UserRating(1184, 0, 1, 0));
    }

    @Test
    void equalRatingsBlackWins() {
        RatingUpdate u = engine.rate(new UserRating(1200, 3, 2, 1), new UserRating(1200, 0, 0, 0), GameResult.BLACK);

        assertThat(u.white()).isEqualTo(new UserRating(1184, 3, 3, 1));
        assertThat(u.black()).isEqualTo(new UserRating(1216, 1, 0, 0));
    }

    @Test
    void drawMovesRatingsTowardEachOther() {
        RatingUpdate u = engine.rate(new UserRating(1600, 0, 0, 0), new UserRating(1200, 0, 0, 0), GameResult.DRAW);

        assertThat(u.white()).isEqualTo(new UserRating(1587, 0, 0, 1));
        assertThat(u.black()).isEqualTo(new UserRating(1213, 0, 0, 1));
    }

    @Test
    void equalDrawKeepsRatings() {
        RatingUpdate u = engine.rate(new UserRating(1200, 0, 0, 0), new UserRating(1200, 0, 0, 0), GameResult.DRAW);

        assertThat(u.white().rating()).isEqualTo(1200);
        assertThat(u.black().rating()).isEqualTo(1200);
    }

    @Test
    void ratingNeverDropsBelowFloor() {
        RatingUpdate u = engine.rate(new UserRating(100, 0, 9, 0), new UserRating(100, 0, 0, 0), GameResult.BLACK);

        assertThat(u.white().rating()).isEqualTo(EloRatingEngine.DEFAULT_FLOOR);
        assertThat(u.white().losses()).isEqualTo(10);
        assertThat(u.black().rating()).isEqualTo(116);
    }

    @Test
    void expectedScoresSumToOne() {
        double e1 = EloRatingEngine.expected(1500, 1320);
        double e2 = EloRatingEngine.expected(1320, 1500);

        assertThat(e1 + e2).isCloseTo(1.0, within(1e-9));
        assertThat(e1).isGreaterThan(0.5);
    }
}
