package com.chesshub.chessservice.infrastructure.persistence;

import com.chesshub.chessservice.games.chess.domain.model.UserRating;
import com.chesshub.chessservice.games.chess.domain.repository.AccountStore;
import com.chesshub.chessservice.infrastructure.persistence.entity.UserAccount;
import com.chesshub.chessservice.infrastructure.persistence.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * AccountStore 的 JPA 实现。
 * 读取即加行锁，锁在外层事务提交/回滚时释放。
 */
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class JpaAccountStore implements AccountStore {

    private final UserAccountRepository repository;

    @Override
    public Optional<UserRating> getUser(Long userId) {
        return repository.findByIdForUpdate(userId).map(JpaAccountStore::toRating);
    }

    @Override
    public void updateUser(Long userId, UserRating rating) {
        UserAccount account = repository.findByIdForUpdate(userId)
                .orElseThrow(() -> new NoSuchElementException("账号不存在: " + userId));
        account.setRating(rating.rating());
        account.setWins(rating.wins());
        account.setLosses(rating.losses());
        account.setDraws(rating.draws());
        repository.save(account);
    }

    static UserRating toRating(UserAccount a) {
        return new UserRating(a.getRating(), a.getWins(), a.getLosses(), a.getDraws());
    }
}
