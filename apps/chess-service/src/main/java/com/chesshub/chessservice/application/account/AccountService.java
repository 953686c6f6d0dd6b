package com.chesshub.chessservice.application.account;

import com.chesshub.chessservice.common.AuthenticationFailedException;
import com.chesshub.chessservice.infrastructure.persistence.entity.UserAccount;
import com.chesshub.chessservice.infrastructure.persistence.repository.UserAccountRepository;
import com.chesshub.chessservice.platform.config.ChessProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.NoSuchElementException;

/**
 * 账号服务：注册、登录、查询战绩。
 * 只负责账号本身，不签发令牌；WebSocket 连接的身份由客户端自报。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    static final int MIN_USERNAME_LENGTH = 3;
    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserAccountRepository repository;
    private final PasswordEncoder passwordEncoder;
    private final ChessProperties properties;

    /**
     * 注册新账号。
     *
     * @throws IllegalArgumentException 用户名或密码过短
     * @throws IllegalStateException    用户名已被占用
     */
    @Transactional
    public AccountProfile signup(String rawUsername, String password) {
        String username = StringUtils.trimToEmpty(rawUsername);
        if (username.length() < MIN_USERNAME_LENGTH) {
            throw new IllegalArgumentException("Username must be at least 3 characters");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("Password must be at least 6 characters");
        }
        if (repository.existsByUsername(username)) {
            throw new IllegalStateException("Username already taken");
        }

        UserAccount account = UserAccount.builder()
                .username(username)
                .passwordHash(passwordEncoder.encode(password))
                .rating(properties.getRating().getInitial())
                .build();
        try {
            account = repository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            // 并发注册同名：唯一约束兜底
            throw new IllegalStateException("Username already taken", e);
        }
        log.info("账号注册成功: userId={}, username={}", account.getId(), username);
        return AccountProfile.from(account);
    }

    /**
     * 校验用户名密码。
     *
     * @throws AuthenticationFailedException 用户不存在或密码错误
     */
    @Transactional(readOnly = true)
    public LoginResult login(String rawUsername, String password) {
        String username = StringUtils.trimToEmpty(rawUsername);
        UserAccount account = repository.findByUsername(username)
                .filter(a -> password != null && passwordEncoder.matches(password, a.getPasswordHash()))
                .orElseThrow(() -> new AuthenticationFailedException("Invalid username or password"));
        return new LoginResult(account.getId(), account.getUsername());
    }

    @Transactional(readOnly = true)
    public AccountProfile profile(Long userId) {
        return repository.findById(userId)
                .map(AccountProfile::from)
                .orElseThrow(() -> new NoSuchElementException("User not found: " + userId));
    }
}
