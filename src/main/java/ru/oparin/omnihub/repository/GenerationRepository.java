package ru.oparin.omnihub.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.entity.Generation;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Репозиторий единиц генерации.
 * <p>
 * Статус меняется только условными UPDATE-запросами: запрос проверяет текущий статус,
 * и побеждает ровно один из конкурирующих переходов (webhook, опрос, таймаут, отмена).
 * В самописных запросах статусы передаются строками, как они хранятся в таблице.
 */
@Repository
public interface GenerationRepository extends ReactiveCrudRepository<Generation, Long> {

    Flux<Generation> findByCorrelationIdOrderByIdAsc(String correlationId);

    Mono<Generation> findByProviderAndProviderJobId(GenerationProvider provider, String providerJobId);

    /**
     * Найти активные (нетерминальные) единицы пользователя.
     *
     * @param userId   идентификатор пользователя
     * @param statuses список статусов для поиска
     * @return поток активных единиц
     */
    Flux<Generation> findByUserIdAndStatusInOrderByIdDesc(Long userId, Collection<GenerationStatus> statuses);

    /**
     * Найти отправленные асинхронные единицы, начатые раньше указанного момента.
     * Используется планировщиком для опроса зависших задач.
     */
    @Query("SELECT * FROM omnihub.generations WHERE status IN (:statuses) " +
           "AND provider_job_id IS NOT NULL AND started_at < :startedBefore ORDER BY started_at")
    Flux<Generation> findDispatchedStartedBefore(Collection<String> statuses, LocalDateTime startedBefore);

    /**
     * Найти активные единицы без задачи у провайдера, не менявшиеся с указанного момента.
     * Такие единицы остаются после перезапуска приложения посреди синхронного вызова или потока.
     */
    @Query("SELECT * FROM omnihub.generations WHERE status IN (:statuses) " +
           "AND provider_job_id IS NULL AND updated_at < :updatedBefore ORDER BY id")
    Flux<Generation> findAbandonedUpdatedBefore(Collection<String> statuses, LocalDateTime updatedBefore);

    /**
     * Зафиксировать резерв и начало отправки единицы.
     */
    @Modifying
    @Query("UPDATE omnihub.generations SET status = :next, estimated_credits = :estimatedCredits, " +
           "credit_source = :creditSource, reservation_id = :reservationId, started_at = :startedAt, " +
           "updated_at = CURRENT_TIMESTAMP WHERE id = :id AND status IN (:expected)")
    Mono<Integer> markReserved(Long id, Collection<String> expected, String next, BigDecimal estimatedCredits,
                               String creditSource, Long reservationId, LocalDateTime startedAt);

    /**
     * Перевести единицу в новый нетерминальный статус, если текущий статус входит в список допустимых.
     *
     * @return 1 если переход выполнен, иначе 0
     */
    @Modifying
    @Query("UPDATE omnihub.generations SET status = :next, updated_at = CURRENT_TIMESTAMP " +
           "WHERE id = :id AND status IN (:expected)")
    Mono<Integer> transition(Long id, Collection<String> expected, String next);

    /**
     * Зафиксировать отправку асинхронной задачи провайдеру.
     */
    @Modifying
    @Query("UPDATE omnihub.generations SET status = :next, provider = :provider, provider_job_id = :jobId, " +
           "queue_position = :queuePosition, updated_at = CURRENT_TIMESTAMP " +
           "WHERE id = :id AND status IN (:expected)")
    Mono<Integer> markSubmitted(Long id, Collection<String> expected, String next,
                                String provider, String jobId, Integer queuePosition);

    /**
     * Обновить позицию в очереди у нетерминальной единицы.
     */
    @Modifying
    @Query("UPDATE omnihub.generations SET status = :next, queue_position = :queuePosition, " +
           "updated_at = CURRENT_TIMESTAMP WHERE id = :id AND status IN (:expected)")
    Mono<Integer> updateProgress(Long id, Collection<String> expected, String next, Integer queuePosition);

    /**
     * Захватить право на терминальный переход. Статус меняется в COMPLETED или FAILED
     * только если единица еще не терминальна; остальные поля дописываются после захвата.
     *
     * @return 1 если этот вызов выполнил терминальный переход, иначе 0
     */
    @Modifying
    @Query("UPDATE omnihub.generations SET status = :terminal, completed_at = :completedAt, " +
           "updated_at = CURRENT_TIMESTAMP WHERE id = :id AND status IN (:active)")
    Mono<Integer> claimTerminal(Long id, Collection<String> active, String terminal, LocalDateTime completedAt);
}
