package ru.oparin.omnihub.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.entity.Workspace;

import java.math.BigDecimal;

@Repository
public interface WorkspaceRepository extends ReactiveCrudRepository<Workspace, Long> {

    /**
     * Найти дефолтный (личный) workspace пользователя.
     */
    @Query("SELECT * FROM omnihub.workspaces WHERE owner_id = :ownerId AND is_default = TRUE")
    Mono<Workspace> findDefaultByOwnerId(Long ownerId);

    /**
     * Атомарно списать кредиты с общего пула workspace, если их достаточно.
     *
     * @return 1 если списание выполнено, иначе 0
     */
    @Modifying
    @Query("UPDATE omnihub.workspaces SET credits = credits - :amount WHERE id = :id AND credits >= :amount")
    Mono<Integer> debitIfSufficient(Long id, BigDecimal amount);

    @Modifying
    @Query("UPDATE omnihub.workspaces SET credits = credits + :amount WHERE id = :id")
    Mono<Integer> credit(Long id, BigDecimal amount);

    @Query("SELECT credits FROM omnihub.workspaces WHERE id = :id")
    Mono<BigDecimal> findCreditsById(Long id);
}
