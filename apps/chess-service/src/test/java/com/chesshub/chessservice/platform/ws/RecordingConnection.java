package com.chesshub.chessservice.platform.ws;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 测试用连接：记录收到的每一帧，可模拟发送失败。
 */
public class RecordingConnection implements PlayerConnection {

    private final String id;
    private final Long userId;
    private final String username;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;

    public RecordingConnection(String id) {
        this(id, null, null);
    }

    public RecordingConnection(String id, Long userId, String username) {
        this.id = id;
        this.userId = userId;
        this.username = username;
    }

    public List<String> sent() {
        return sent;
    }

    public void failSends() {
        this.failSends = true;
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
    public void send(String payload) throws IOException {
        if (failSends) throw new IOException("broken pipe");
        sent.add(payload);
    }

    @Override
    public void close() {
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }
}
