package com.chesshub.chessservice.games.chess.service.impl;

import com.chesshub.chessservice.games.chess.domain.constants.GameMessages;
import com.chesshub.chessservice.games.chess.domain.enums.Seat;
import com.chesshub.chessservice.games.chess.domain.enums.SeatPreference;
import com.chesshub.chessservice.games.chess.domain.model.GameRecord;
import com.chesshub.chessservice.games.chess.domain.model.Room;
import com.chesshub.chessservice.games.chess.domain.rule.ChessMove;
import com.chesshub.chessservice.games.chess.domain.rule.MoveParseException;
import com.chesshub.chessservice.games.chess.domain.rule.Outcome;
import com.chesshub.chessservice.games.chess.domain.rule.RulesEngine;
import com.chesshub.chessservice.games.chess.interfaces.ws.dto.ChessMessages;
import com.chesshub.chessservice.games.chess.interfaces.ws.dto.ChessMessages.ErrorMessage;
import com.chesshub.chessservice.games.chess.interfaces.ws.dto.ChessMessages.StateMessage;
import com.chesshub.chessservice.games.chess.service.ChessRoomService;
import com.chesshub.chessservice.games.chess.service.CommandResult;
import com.chesshub.chessservice.games.chess.service.GameFinalizer;
import com.chesshub.chessservice.games.chess.service.RoomRegistry;
import com.chesshub.chessservice.platform.ws.ConnectionManager;
import com.chesshub.chessservice.platform.ws.PlayerConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * 房间服务实现。
 * 每个操作在房间锁内完成：座位表、棋盘、历史、终局标记与出站入队处于同一临界区，
 * 因此同一房间的广播顺序与走子顺序一致。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChessRoomServiceImpl implements ChessRoomService {

    private final RoomRegistry registry;
    private final RulesEngine rules;
    private final ConnectionManager connections;
    private final GameFinalizer finalizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public CommandResult join(String roomId, PlayerConnection connection, SeatPreference preference) {
        Room room = registry.getOrCreate(roomId);
        return room.withLock(() -> {
            Seat seat = room.assignSeat(connection.id(), preference, connection.userId());
            connections.register(roomId, connection);
            connections.send(roomId, connection.id(), StateMessage.initial(rules.serialize(room.getBoard()), seat));
            log.info("连接入座: roomId={}, connectionId={}, userId={}, preferred={}, seat={}",
                    roomId, connection.id(), connection.userId(), preference, seat);
            return CommandResult.accepted();
        });
    }

    @Override
    public CommandResult handleMessage(String roomId, String connectionId, String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return reject(roomId, connectionId, GameMessages.MALFORMED_MESSAGE);
        }
        if (node == null || !node.isObject() || !node.path("type").isTextual()) {
            return reject(roomId, connectionId, GameMessages.MALFORMED_MESSAGE);
        }

        String type = node.get("type").asText();
        if (ChessMessages.TYPE_MOVE.equals(type)) {
            JsonNode move = node.get("move");
            if (move == null || !move.isTextual()) {
                return reject(roomId, connectionId, GameMessages.MALFORMED_MESSAGE);
            }
            return handleMove(roomId, connectionId, move.asText());
        }
        return reject(roomId, connectionId, GameMessages.UNSUPPORTED_MESSAGE_TYPE);
    }

    @Override
    public CommandResult handleMove(String roomId, String connectionId, String moveText) {
        Optional<Room> found = registry.find(roomId);
        if (found.isEmpty()) {
            return reject(roomId, connectionId, GameMessages.INVALID_MOVE);
        }
        Room room = found.get();
        return room.withLock(() -> applyMove(room, connectionId, moveText));
    }

    /** 走子状态机（调用方持有房间锁） */
    private CommandResult applyMove(Room room, String connectionId, String moveText) {
        String roomId = room.getId();
        if (room.isFinished()) {
            return reject(roomId, connectionId, GameMessages.GAME_ALREADY_OVER);
        }
        Seat seat = room.seatOf(connectionId);
        if (!seat.isPlayer()) {
            return reject(roomId, connectionId, GameMessages.SPECTATOR_CANNOT_MOVE);
        }
        if (seat.color() != rules.sideToMove(room.getBoard())) {
            return reject(roomId, connectionId, GameMessages.NOT_YOUR_TURN);
        }

        ChessMove move;
        try {
            move = rules.parseMove(moveText);
        } catch (MoveParseException e) {
            return reject(roomId, connectionId, GameMessages.INVALID_MOVE);
        }
        if (!rules.isLegal(room.getBoard(), move)) {
            return reject(roomId, connectionId, GameMessages.INVALID_MOVE);
        }

        rules.apply(room.getBoard(), move);
        String uci = move.uci();
        room.appendMove(uci);

        Outcome outcome = rules.classifyTerminal(room.getBoard()).orElse(null);
        String fen = rules.serialize(room.getBoard());
        connections.broadcast(roomId, connId -> StateMessage.afterMove(fen, room.seatOf(connId), uci, outcome));

        if (outcome != null) {
            log.info("对局结束: roomId={}, result={}, reason={}, moves={}",
                    roomId, outcome.result().code(), outcome.reason().code(), room.getMoveHistory().size());
            finalizeOnce(room, outcome);
            room.markFinished();
        }
        return CommandResult.accepted();
    }

    /**
     * 结算至多一次；失败只记录并打标记，不回滚已广播的终局状态。
     */
    private void finalizeOnce(Room room, Outcome outcome) {
        if (!room.beginFinalize()) return;

        GameRecord record = GameRecord.builder()
                .roomId(room.getId())
                .whiteUserId(room.getWhiteUserId())
                .blackUserId(room.getBlackUserId())
                .result(outcome.result())
                .reason(outcome.reason())
                .moves(new ArrayList<>(room.getMoveHistory()))
                .createdAt(room.getCreatedAt())
                .finishedAt(Instant.now(clock))
                .build();
        try {
            finalizer.finalizeGame(record);
        } catch (RuntimeException e) {
            room.markFinalizeFailed();
            log.error("对局结算失败: roomId={}, result={}", room.getId(), outcome.result().code(), e);
        }
    }

    @Override
    public void leave(String roomId, String connectionId) {
        registry.find(roomId).ifPresent(room -> room.withLock(() -> {
            Seat seat = room.release(connectionId);
            connections.unregister(roomId, connectionId);
            log.info("连接断开: roomId={}, connectionId={}, seat={}", roomId, connectionId, seat);
        }));
    }

    private CommandResult reject(String roomId, String connectionId, String message) {
        log.debug("指令被拒绝: roomId={}, connectionId={}, reason={}", roomId, connectionId, message);
        connections.send(roomId, connectionId, new ErrorMessage(message));
        return CommandResult.rejected(message);
    }
}
