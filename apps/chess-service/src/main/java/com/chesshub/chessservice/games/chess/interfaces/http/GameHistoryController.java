package com.chesshub.chessservice.games.chess.interfaces.http;

import com.chesshub.chessservice.games.chess.domain.repository.GameRecordStore;
import com.chesshub.chessservice.games.chess.interfaces.http.dto.GameRecordView;
import com.chesshub.chessservice.platform.config.ChessProperties;
import com.chesshub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 已结束对局查询。
 */
@RestController
@RequestMapping("/api/chess/games")
@RequiredArgsConstructor
public class GameHistoryController {

    private final GameRecordStore recordStore;
    private final ChessProperties properties;

    /**
     * @param userId 只看该账号参与的对局（可空）
     * @param limit  条数，默认 20，超过上限按上限截断
     */
    @GetMapping
    public ApiResponse<List<GameRecordView>> recent(
            @RequestParam(value = "userId", required = false) Long userId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        ChessProperties.History history = properties.getHistory();
        int n = limit == null ? history.getDefaultLimit() : limit;
        if (n < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        n = Math.min(n, history.getMaxLimit());
        return ApiResponse.success(recordStore.findRecent(userId, n).stream().map(GameRecordView::from).toList());
    }
}
