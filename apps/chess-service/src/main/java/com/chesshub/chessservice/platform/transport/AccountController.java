package com.chesshub.chessservice.platform.transport;

import com.chesshub.chessservice.application.account.AccountCredentials;
import com.chesshub.chessservice.application.account.AccountProfile;
import com.chesshub.chessservice.application.account.AccountService;
import com.chesshub.chessservice.application.account.LoginResult;
import com.chesshub.chessservice.platform.online.OnlineUser;
import com.chesshub.chessservice.platform.online.OnlineUserTracker;
import com.chesshub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 账号接口：注册 / 登录 / 在线用户 / 战绩。
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final OnlineUserTracker onlineUserTracker;

    @PostMapping("/signup")
    public ResponseEntity<ApiResponse<AccountProfile>> signup(@RequestBody AccountCredentials body) {
        AccountProfile created = accountService.signup(body.getUsername(), body.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("User created", created));
    }

    @PostMapping("/login")
    public ApiResponse<LoginResult> login(@RequestBody AccountCredentials body) {
        return ApiResponse.success(accountService.login(body.getUsername(), body.getPassword()));
    }

    @GetMapping("/online")
    public ApiResponse<List<OnlineUser>> online() {
        return ApiResponse.success(onlineUserTracker.onlineUsers());
    }

    @GetMapping("/{userId}")
    public ApiResponse<AccountProfile> profile(@PathVariable Long userId) {
        return ApiResponse.success(accountService.profile(userId));
    }
}
