package com.chesshub.chessservice.application.account;

import lombok.Data;

/**
 * 注册 / 登录请求体。
 */
@Data
public class AccountCredentials {
    private String username;
    private String password;
}
