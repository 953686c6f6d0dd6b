package com.chesshub.chessservice.games.chess.service;

/**
 * 一条入站指令的处理结果：接受，或带原因拒绝。
 */
public record CommandResult(Status status, String message) {

    public enum Status {
        ACCEPTED,
        REJECTED
    }

    private static final CommandResult ACCEPTED = new CommandResult(Status.ACCEPTED, null);

    public static CommandResult accepted() {
        return ACCEPTED;
    }

    public static CommandResult rejected(String message) {
        return new CommandResult(Status.REJECTED, message);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
