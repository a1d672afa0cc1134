package ru.oparin.omnihub.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.entity.CreditReservation;

import java.math.BigDecimal;

@Repository
public interface CreditReservationRepository extends ReactiveCrudRepository<CreditReservation, Long> {

    Mono<CreditReservation> findByGenerationId(Long generationId);

    /**
     * Закрыть резервирование, если оно еще открыто.
     * Условие по статусу гарантирует, что settle или refund выполнится ровно один раз.
     *
     * @param id            идентификатор резервирования
     * @param status        новый статус (SETTLED или REFUNDED)
     * @param settledAmount фактически списанная сумма (0 при возврате)
     * @return 1 если резервирование закрыто этим вызовом, 0 если оно уже было закрыто
     */
    @Modifying
    @Query("UPDATE omnihub.credit_reservations SET status = :status, settled_amount = :settledAmount, " +
           "updated_at = CURRENT_TIMESTAMP WHERE id = :id AND status = 'RESERVED'")
    Mono<Integer> closeIfReserved(Long id, String status, BigDecimal settledAmount);
}
