package com.chesshub.chessservice.platform.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 房间内在线连接表 + 出站发送。
 * <p>
 * 每条连接一个出站队列：调用方（持有房间锁）只入队，真正的网络发送在出站线程池上完成，
 * 慢连接不会阻塞房间锁或其它连接；同一连接的消息按入队顺序发出。
 * 发送失败只注销并关闭该连接，不重试。
 */
@Slf4j
@Component
public class ConnectionManager {

    /** roomId -> (connectionId -> 出站通道) */
    private final Map<String, Map<String, Outbox>> rooms = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final TaskExecutor outboundExecutor;

    public ConnectionManager(ObjectMapper objectMapper,
                             @Qualifier("chessOutboundExecutor") TaskExecutor outboundExecutor) {
        this.objectMapper = objectMapper;
        this.outboundExecutor = outboundExecutor;
    }

    public void register(String roomId, PlayerConnection connection) {
        rooms.computeIfAbsent(roomId, id -> new ConcurrentHashMap<>())
                .put(connection.id(), new Outbox(roomId, connection));
    }

    /** 注销连接；返回被移除的连接，不存在返回 null */
    public PlayerConnection unregister(String roomId, String connectionId) {
        Map<String, Outbox> conns = rooms.get(roomId);
        if (conns == null) return null;
        Outbox removed = conns.remove(connectionId);
        if (removed == null) return null;
        removed.discard();
        return removed.connection;
    }

    /** 房间内当前在线连接（快照） */
    public List<PlayerConnection> connections(String roomId) {
        Map<String, Outbox> conns = rooms.get(roomId);
        if (conns == null) return List.of();
        List<PlayerConnection> list = new ArrayList<>(conns.size());
        for (Outbox o : conns.values()) list.add(o.connection);
        return list;
    }

    /** 全部房间的在线连接（快照） */
    public List<PlayerConnection> allConnections() {
        List<PlayerConnection> list = new ArrayList<>();
        for (Map<String, Outbox> conns : rooms.values()) {
            for (Outbox o : conns.values()) list.add(o.connection);
        }
        return list;
    }

    public boolean isRegistered(String roomId, String connectionId) {
        Map<String, Outbox> conns = rooms.get(roomId);
        return conns != null && conns.containsKey(connectionId);
    }

    /** 单播：序列化后入队 */
    public void send(String roomId, String connectionId, Object payload) {
        Map<String, Outbox> conns = rooms.get(roomId);
        Outbox outbox = conns == null ? null : conns.get(connectionId);
        if (outbox == null) return;
        String json = serialize(payload);
        if (json != null) outbox.enqueue(json);
    }

    /**
     * 广播：按接收者逐个生成消息（各自的座位不同），每个连接一份。
     *
     * @param payloadFor connectionId -> 消息对象
     */
    public void broadcast(String roomId, Function<String, Object> payloadFor) {
        Map<String, Outbox> conns = rooms.get(roomId);
        if (conns == null) return;
        for (Outbox outbox : new ArrayList<>(conns.values())) {
            String json = serialize(payloadFor.apply(outbox.connection.id()));
            if (json != null) outbox.enqueue(json);
        }
    }

    private String serialize(Object payload) {
        if (payload instanceof String s) return s;
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("消息序列化失败: type={}", payload == null ? null : payload.getClass().getSimpleName(), e);
            return null;
        }
    }

    private void onSendFailure(Outbox outbox, IOException e) {
        String connId = outbox.connection.id();
        log.warn("发送失败，断开连接: roomId={}, connectionId={}, error={}", outbox.roomId, connId, e.getMessage());
        Map<String, Outbox> conns = rooms.get(outbox.roomId);
        if (conns != null) conns.remove(connId, outbox);
        outbox.discard();
        outbox.connection.close();
    }

    /**
     * 单连接出站通道：无界队列 + 单消费者。
     */
    private final class Outbox {
        private final String roomId;
        private final PlayerConnection connection;
        private final Queue<String> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private volatile boolean discarded;

        private Outbox(String roomId, PlayerConnection connection) {
            this.roomId = roomId;
            this.connection = connection;
        }

        void enqueue(String json) {
            if (discarded) return;
            queue.add(json);
            scheduleDrain();
        }

        void discard() {
            discarded = true;
            queue.clear();
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                outboundExecutor.execute(this::drain);
            }
        }

        private void drain() {
            try {
                String next;
                while (!discarded && (next = queue.poll()) != null) {
                    try {
                        connection.send(next);
                    } catch (IOException e) {
                        onSendFailure(this, e);
                        return;
                    }
                }
            } finally {
                draining.set(false);
            }
            // 释放标志与新消息入队之间的竞态
            if (!discarded && !queue.isEmpty()) scheduleDrain();
        }
    }
}
