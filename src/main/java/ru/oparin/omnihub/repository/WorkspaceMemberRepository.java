package ru.oparin.omnihub.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.entity.WorkspaceMember;

import java.math.BigDecimal;

@Repository
public interface WorkspaceMemberRepository extends ReactiveCrudRepository<WorkspaceMember, Long> {

    Mono<WorkspaceMember> findByWorkspaceIdAndUserId(Long workspaceId, Long userId);

    /**
     * Атомарно списать кредиты с аллокации участника, если их достаточно.
     *
     * @return 1 если списание выполнено, иначе 0
     */
    @Modifying
    @Query("UPDATE omnihub.workspace_members SET allocated_credits = allocated_credits - :amount " +
           "WHERE workspace_id = :workspaceId AND user_id = :userId AND allocated_credits >= :amount")
    Mono<Integer> debitIfSufficient(Long workspaceId, Long userId, BigDecimal amount);

    @Modifying
    @Query("UPDATE omnihub.workspace_members SET allocated_credits = allocated_credits + :amount " +
           "WHERE workspace_id = :workspaceId AND user_id = :userId")
    Mono<Integer> credit(Long workspaceId, Long userId, BigDecimal amount);

    @Query("SELECT allocated_credits FROM omnihub.workspace_members WHERE workspace_id = :workspaceId AND user_id = :userId")
    Mono<BigDecimal> findAllocatedCredits(Long workspaceId, Long userId);
}
