package com.chesshub.chessservice.common;

/**
 * 用户名或密码错误。
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
