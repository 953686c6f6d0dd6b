package com.chesshub.chessservice.platform.ws;

import com.chesshub.chessservice.games.chess.domain.enums.SeatPreference;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * 握手阶段解析出的连接参数：/ws/{roomId}?user_id=&username=&preferred=
 */
public record ConnectParams(String roomId, Long userId, String username, SeatPreference preference) {

    /** 握手属性中的键 */
    public static final String ATTRIBUTE = "chess.connectParams";

    public static ConnectParams parse(String roomId, Map<String, String> query) {
        String rawUserId = query.get("user_id");
        Long userId = null;
        if (StringUtils.isNumeric(StringUtils.trim(rawUserId))) {
            try {
                userId = Long.valueOf(rawUserId.trim());
            } catch (NumberFormatException e) {
                // 超出 long 范围的数字串同样视为未提供
                userId = null;
            }
        }
        String username = StringUtils.trimToNull(query.get("username"));
        return new ConnectParams(roomId, userId, username, SeatPreference.parse(query.get("preferred")));
    }
}
