package com.chesshub.chessservice.platform.config;

import com.chesshub.chessservice.games.chess.domain.rating.EloRatingEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * 对局服务的基础 Bean：出站发送线程池、评分引擎、时钟、密码编码器。
 * 出站线程池与 Web 容器线程分开，慢连接的写出不占用入站处理线程。
 */
@Configuration
public class ChessServiceConfig {

    @Bean("chessOutboundExecutor")
    public TaskExecutor chessOutboundExecutor(ChessProperties properties) {
        int configured = properties.getWs().getOutboundPoolSize();
        int poolSize = configured > 0 ? configured : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(poolSize);
        exec.setMaxPoolSize(poolSize);
        exec.setThreadNamePrefix("chess-outbound-");
        // 设置为守护线程
        exec.setDaemon(true);
        exec.initialize();
        return exec;
    }

    @Bean
    public EloRatingEngine eloRatingEngine(ChessProperties properties) {
        return new EloRatingEngine(properties.getRating().getK(), properties.getRating().getFloor());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
