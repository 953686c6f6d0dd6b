package com.chesshub.chessservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * chess-service 启动入口。
 */
@SpringBootApplication
public class ChessServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChessServiceApplication.class, args);
    }
}
