package com.chesshub.chessservice.games.chess.domain.enums;

/**
 * 连接时声明的座位意向（w / b / any），仅作参考。
 */
public enum SeatPreference {
    WHITE,
    BLACK,
    ANY;

    /**
     * 解析查询参数；无法识别的值一律视为 ANY。
     */
    public static SeatPreference parse(String raw) {
        if (raw == null) return ANY;
        return switch (raw.trim().toLowerCase()) {
            case "w" -> WHITE;
            case "b" -> BLACK;
            default -> ANY;
        };
    }
}
