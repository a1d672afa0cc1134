package ru.oparin.omnihub.repository;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.entity.LedgerEntry;

import java.math.BigDecimal;

/**
 * Журнал кредитов. Записи только добавляются, поэтому методов изменения здесь нет.
 */
@Repository
public interface LedgerEntryRepository extends ReactiveCrudRepository<LedgerEntry, Long> {

    Flux<LedgerEntry> findByGenerationIdOrderByIdAsc(Long generationId);

    Flux<LedgerEntry> findByReservationIdOrderByIdAsc(Long reservationId);

    /**
     * Сумма изменений личного баланса пользователя по журналу.
     */
    @Query("SELECT COALESCE(SUM(balance_delta), 0) FROM omnihub.ledger_entries " +
           "WHERE source_type = 'PERSONAL' AND user_id = :userId")
    Mono<BigDecimal> sumPersonalDelta(Long userId);

    /**
     * Сумма изменений общего пула workspace по журналу.
     */
    @Query("SELECT COALESCE(SUM(balance_delta), 0) FROM omnihub.ledger_entries " +
           "WHERE source_type = 'WORKSPACE' AND workspace_id = :workspaceId")
    Mono<BigDecimal> sumWorkspaceDelta(Long workspaceId);

    /**
     * Сумма изменений аллокации участника по журналу.
     */
    @Query("SELECT COALESCE(SUM(balance_delta), 0) FROM omnihub.ledger_entries " +
           "WHERE source_type = 'ALLOCATED' AND workspace_id = :workspaceId AND user_id = :userId")
    Mono<BigDecimal> sumAllocatedDelta(Long workspaceId, Long userId);
}
