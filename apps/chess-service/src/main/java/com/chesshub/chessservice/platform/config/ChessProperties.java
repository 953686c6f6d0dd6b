package com.chesshub.chessservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局服务配置（前缀 chess）。
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Data
@Component
@ConfigurationProperties(prefix = "chess")
public class ChessProperties {

    private Ws ws = new Ws();
    private Rating rating = new Rating();
    private History history = new History();

    @Data
    public static class Ws {
        /** 端点前缀，房间 id 作为最后一段路径 */
        private String path = "/ws";
        /** 允许的来源（origin pattern） */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        /** 出站发送线程数；0 表示按 CPU 核数计算 */
        private int outboundPoolSize = 0;
    }

    @Data
    public static class Rating {
        /** Elo K 值 */
        private int k = 32;
        private int floor = 100;
        /** 新账号初始等级分 */
        private int initial = 1200;
    }

    @Data
    public static class History {
        private int defaultLimit = 20;
        private int maxLimit = 100;
    }
}
