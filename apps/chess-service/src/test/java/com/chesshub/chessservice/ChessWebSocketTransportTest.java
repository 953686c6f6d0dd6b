package com.chesshub.chessservice;

import com.chesshub.chessservice.games.chess.domain.enums.Seat;
import com.chesshub.chessservice.games.chess.domain.model.Room;
import com.chesshub.chessservice.games.chess.service.RoomRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 真实 WebSocket 客户端走一遍 /ws/{roomId}：握手参数、入座、广播、错误帧、断开离座。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ChessWebSocketTransportTest {

    private static final long TIMEOUT_SECONDS = 5;

    @LocalServerPort
    private int port;
    @Autowired
    private RoomRegistry registry;

    private final ObjectMapper json = new ObjectMapper();
    private final StandardWebSocketClient client = new StandardWebSocketClient();
    private final List<WebSocketSession> opened = new ArrayList<>();

    @AfterEach
    void closeSessions() throws Exception {
        for (WebSocketSession s : opened) {
            if (s.isOpen()) s.close();
        }
    }

    @Test
    void twoSocketsPlayAMoveAndMalformedFrameKeepsSocketOpen() throws Exception {
        Inbox white = new Inbox();
        Inbox black = new Inbox();
        WebSocketSession w = connect(white, "/ws/ws-room-1?preferred=w&username=alice");
        JsonNode whiteHello = white.next();
        WebSocketSession b = connect(black, "/ws/ws-room-1?preferred=b&username=bob");
        JsonNode blackHello = black.next();
        assertThat(whiteHello.get("type").asText()).isEqualTo("state");
        assertThat(whiteHello.get("color").asText()).isEqualTo("w");
        assertThat(blackHello.get("color").asText()).isEqualTo("b");
        assertThat(whiteHello.has("last_move")).isFalse();

        w.sendMessage(new TextMessage("{\"type\":\"move\",\"move\":\"e2e4\"}"));

        JsonNode whiteState = white.next();
        JsonNode blackState = black.next();
        assertThat(whiteState.get("last_move").asText()).isEqualTo("e2e4");
        assertThat(blackState.get("last_move").asText()).isEqualTo("e2e4");
        assertThat(whiteState.get("fen").asText()).isEqualTo(blackState.get("fen").asText());
        assertThat(whiteState.get("color").asText()).isEqualTo("w");
        assertThat(blackState.get("color").asText()).isEqualTo("b");
        assertThat(whiteState.has("game_over")).isFalse();

        b.sendMessage(new TextMessage("garbage"));

        JsonNode error = black.next();
        assertThat(error.get("type").asText()).isEqualTo("error");
        assertThat(error.get("message").asText()).isEqualTo("Malformed message");
        assertThat(b.isOpen()).isTrue();
        assertThat(white.queue).isEmpty();

        // 出错后同一连接仍可继续走子
        b.sendMessage(new TextMessage("{\"type\":\"move\",\"move\":\"e7e5\"}"));
        assertThat(white.next().get("last_move").asText()).isEqualTo("e7e5");
        assertThat(black.next().get("last_move").asText()).isEqualTo("e7e5");
    }

    @Test
    void spectatorMoveIsRejectedOnlyToSender() throws Exception {
        Inbox white = new Inbox();
        Inbox black = new Inbox();
        Inbox watcher = new Inbox();
        connect(white, "/ws/ws-room-2");
        assertThat(white.next().get("color").asText()).isEqualTo("w");
        connect(black, "/ws/ws-room-2");
        assertThat(black.next().get("color").asText()).isEqualTo("b");
        WebSocketSession s = connect(watcher, "/ws/ws-room-2?preferred=w");
        assertThat(watcher.next().get("color").asText()).isEqualTo("spectator");

        s.sendMessage(new TextMessage("{\"type\":\"move\",\"move\":\"e2e4\"}"));

        assertThat(watcher.next().get("message").asText()).isEqualTo("Spectators cannot make moves");
        assertThat(white.queue.poll(300, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void closingSocketReleasesSeat() throws Exception {
        Inbox white = new Inbox();
        WebSocketSession w = connect(white, "/ws/ws-room-3?preferred=w");
        assertThat(white.next().get("color").asText()).isEqualTo("w");

        Room room = registry.find("ws-room-3").orElseThrow();
        assertThat(whiteSeatTaken(room)).isTrue();

        w.close(CloseStatus.NORMAL);

        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
        while (whiteSeatTaken(room) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(whiteSeatTaken(room)).isFalse();
    }

    private static boolean whiteSeatTaken(Room room) {
        return room.withLock(() -> room.occupied(Seat.WHITE));
    }

    private WebSocketSession connect(Inbox inbox, String pathAndQuery) throws Exception {
        WebSocketSession session = client.execute(inbox, "ws://localhost:" + port + pathAndQuery)
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        opened.add(session);
        return session;
    }

    /** 客户端收件箱：按到达顺序保存每一帧 */
    private final class Inbox extends TextWebSocketHandler {
        private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            queue.add(message.getPayload());
        }

        JsonNode next() throws Exception {
            String frame = queue.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            assertThat(frame).as("expected a frame within %ss", TIMEOUT_SECONDS).isNotNull();
            return json.readTree(frame);
        }
    }
}
