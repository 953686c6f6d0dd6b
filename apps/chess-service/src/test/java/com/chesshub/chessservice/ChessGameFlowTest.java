package com.chesshub.chessservice;

import com.chesshub.chessservice.application.account.AccountProfile;
import com.chesshub.chessservice.application.account.AccountService;
import com.chesshub.chessservice.games.chess.domain.enums.SeatPreference;
import com.chesshub.chessservice.games.chess.service.ChessRoomService;
import com.chesshub.chessservice.games.chess.service.RoomRegistry;
import com.chesshub.chessservice.infrastructure.persistence.entity.GameRecordEntity;
import com.chesshub.chessservice.infrastructure.persistence.repository.GameRecordRepository;
import com.chesshub.chessservice.platform.ws.PlayerConnection;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 整链路：注册两个账号 -> 入座 -> 愚者将杀 -> 落库一条记录并更新等级分。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ChessGameFlowTest {

    @Autowired
    private AccountService accountService;
    @Autowired
    private ChessRoomService roomService;
    @Autowired
    private RoomRegistry registry;
    @Autowired
    private GameRecordRepository games;

    @Test
    void forcedMatePersistsOneRecordAndUpdatesRatings() {
        AccountProfile white = accountService.signup("flow-white", "password1");
        AccountProfile black = accountService.signup("flow-black", "password1");

        TestConnection w = new TestConnection("flow-w", white.userId(), "flow-white");
        TestConnection b = new TestConnection("flow-b", black.userId(), "flow-black");
        roomService.join("flow-room", w, SeatPreference.WHITE);
        roomService.join("flow-room", b, SeatPreference.BLACK);

        assertThat(roomService.handleMove("flow-room", w.id(), "f2f3").isAccepted()).isTrue();
        assertThat(roomService.handleMove("flow-room", b.id(), "e7e5").isAccepted()).isTrue();
        assertThat(roomService.handleMove("flow-room", w.id(), "g2g4").isAccepted()).isTrue();
        assertThat(roomService.handleMove("flow-room", b.id(), "d8h4").isAccepted()).isTrue();

        // 终局后重复提交不产生第二条记录
        assertThat(roomService.handleMove("flow-room", w.id(), "e2e4").isAccepted()).isFalse();

        List<GameRecordEntity> records = games.findAll().stream()
                .filter(g -> "flow-room".equals(g.getRoomId()))
                .toList();
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getResult()).isEqualTo("black");
        assertThat(records.get(0).getReason()).isEqualTo("checkmate");
        assertThat(records.get(0).getMoves()).isEqualTo("f2f3 e7e5 g2g4 d8h4");

        assertThat(accountService.profile(white.userId()).rating()).isEqualTo(1184);
        assertThat(accountService.profile(white.userId()).losses()).isEqualTo(1);
        assertThat(accountService.profile(black.userId()).rating()).isEqualTo(1216);
        assertThat(accountService.profile(black.userId()).wins()).isEqualTo(1);

        assertThat(registry.find("flow-room").orElseThrow().isFinished()).isTrue();
        assertThat(registry.find("flow-room").orElseThrow().isFinalizeFailed()).isFalse();
    }

    @Test
    void missingAccountLeavesRatingsUntouchedButFinishes() {
        AccountProfile white = accountService.signup("solo-white", "password1");

        TestConnection w = new TestConnection("solo-w", white.userId(), "solo-white");
        TestConnection b = new TestConnection("solo-b", null, null);
        roomService.join("solo-flow", w, SeatPreference.ANY);
        roomService.join("solo-flow", b, SeatPreference.ANY);

        roomService.handleMove("solo-flow", w.id(), "f2f3");
        roomService.handleMove("solo-flow", b.id(), "e7e5");
        roomService.handleMove("solo-flow", w.id(), "g2g4");
        roomService.handleMove("solo-flow", b.id(), "d8h4");

        assertThat(registry.find("solo-flow").orElseThrow().isFinished()).isTrue();
        assertThat(accountService.profile(white.userId()).rating()).isEqualTo(1200);
        assertThat(games.findAll()).anyMatch(g -> "solo-flow".equals(g.getRoomId()) && g.getBlackId() == null);
    }

    /** 只记录不校验内容；出站发送在独立线程上执行 */
    private static final class TestConnection implements PlayerConnection {
        private final String id;
        private final Long userId;
        private final String username;

        TestConnection(String id, Long userId, String username) {
            this.id = id;
            this.userId = userId;
            this.username = username;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Long userId() {
            return userId;
        }

        @Override
        public String username() {
            return username;
        }

        @Override
        public void send(String payload) {
        }

        @Override
        public void close() {
        }

        @Override
        public boolean isOpen() {
            return true;
        }
    }
}
