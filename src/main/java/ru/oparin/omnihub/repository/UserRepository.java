package ru.oparin.omnihub.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.entity.User;

import java.math.BigDecimal;

@Repository
public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    Mono<User> findByEmail(String email);

    Mono<Boolean> existsByEmail(String email);

    /**
     * Атомарно списать кредиты с личного баланса, если их достаточно.
     *
     * @param id     идентификатор пользователя
     * @param amount сумма списания
     * @return 1 если списание выполнено, 0 если кредитов недостаточно или пользователь не найден
     */
    @Modifying
    @Query("UPDATE omnihub.users SET credits = credits - :amount, updated_at = CURRENT_TIMESTAMP " +
           "WHERE id = :id AND credits >= :amount")
    Mono<Integer> debitIfSufficient(Long id, BigDecimal amount);

    /**
     * Атомарно вернуть кредиты на личный баланс.
     *
     * @param id     идентификатор пользователя
     * @param amount сумма возврата
     * @return количество обновленных строк
     */
    @Modifying
    @Query("UPDATE omnihub.users SET credits = credits + :amount, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    Mono<Integer> credit(Long id, BigDecimal amount);

    @Query("SELECT credits FROM omnihub.users WHERE id = :id")
    Mono<BigDecimal> findCreditsById(Long id);
}
