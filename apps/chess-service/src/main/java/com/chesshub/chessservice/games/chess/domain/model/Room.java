package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.RoomPhase;
import com.chesshub.chessservice.games.chess.domain.enums.Seat;
import com.chesshub.chessservice.games.chess.domain.enums.SeatPreference;
import com.chesshub.chessservice.games.chess.domain.rule.Position;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 对局房间实体（一个房间 = 一盘棋）。
 * <p>
 * 并发约定：座位、棋盘、走子历史、终局标记的所有读写都必须在 {@link #withLock} 内完成，
 * 一次操作一个临界区；不同房间互不影响。
 */
@Getter
public class Room {

    // ---- 基本信息 ----
    private final String id;
    private final Instant createdAt;

    /** 棋盘：只允许通过 RulesEngine 修改 */
    private final Position board;

    // ---- 会话 ↔ 座位 绑定 ----
    /** connectionId -> 座位；断开即移除 */
    @Getter(AccessLevel.NONE)
    private final Map<String, Seat> seatByConnection = new LinkedHashMap<>();

    /** 走子历史（UCI），只追加 */
    private final List<String> moveHistory = new ArrayList<>();

    /** 首个占据白/黑座位的账号（用于等级分），各自至多设置一次 */
    private Long whiteUserId;
    private Long blackUserId;

    /** 终局标记：false -> true 仅一次 */
    private boolean finished;
    /** 结算守卫：保证评分/落库至多触发一次 */
    private boolean finalized;
    /** 结算落库失败（可观测，不回滚已广播的终局状态） */
    private boolean finalizeFailed;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    public Room(String id, Position board, Instant createdAt) {
        this.id = id;
        this.board = board;
        this.createdAt = createdAt;
    }

    /** 在房间临界区内执行一次操作 */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /** 当前线程是否持有房间锁 */
    public boolean isLockedByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /** 座位是否被当前在线连接占用 */
    public boolean occupied(Seat seat) {
        return seatByConnection.containsValue(seat);
    }

    /**
     * 入座：按意向与当前占用情况分配座位，并记录首个执子账号。
     * 1. 意向白且白空 -> 白；2. 意向黑且黑空 -> 黑；3. 白空 -> 白；4. 黑空 -> 黑；5. 观战。
     */
    public Seat assignSeat(String connectionId, SeatPreference preference, Long userId) {
        Seat seat;
        if (preference == SeatPreference.WHITE && !occupied(Seat.WHITE)) {
            seat = Seat.WHITE;
        } else if (preference == SeatPreference.BLACK && !occupied(Seat.BLACK)) {
            seat = Seat.BLACK;
        } else if (!occupied(Seat.WHITE)) {
            seat = Seat.WHITE;
        } else if (!occupied(Seat.BLACK)) {
            seat = Seat.BLACK;
        } else {
            seat = Seat.SPECTATOR;
        }
        seatByConnection.put(connectionId, seat);

        if (userId != null) {
            if (seat == Seat.WHITE && whiteUserId == null) {
                whiteUserId = userId;
            } else if (seat == Seat.BLACK && blackUserId == null) {
                blackUserId = userId;
            }
        }
        return seat;
    }

    /** 断开：释放座位标签（不转交给其他连接） */
    public Seat release(String connectionId) {
        return seatByConnection.remove(connectionId);
    }

    /** 连接的座位；未登记视为观战 */
    public Seat seatOf(String connectionId) {
        return seatByConnection.getOrDefault(connectionId, Seat.SPECTATOR);
    }

    public void appendMove(String uci) {
        moveHistory.add(uci);
    }

    public List<String> getMoveHistory() {
        return Collections.unmodifiableList(moveHistory);
    }

    public int spectatorCount() {
        return (int) seatByConnection.values().stream().filter(s -> s == Seat.SPECTATOR).count();
    }

    public RoomPhase phase() {
        if (finished) return RoomPhase.FINISHED;
        if (!moveHistory.isEmpty() || (occupied(Seat.WHITE) && occupied(Seat.BLACK))) return RoomPhase.ACTIVE;
        return RoomPhase.WAITING;
    }

    /**
     * 抢占结算资格：第一次调用返回 true，之后恒为 false。
     */
    public boolean beginFinalize() {
        if (finalized) return false;
        finalized = true;
        return true;
    }

    public void markFinished() {
        this.finished = true;
    }

    public void markFinalizeFailed() {
        this.finalizeFailed = true;
    }
}
