package ru.oparin.omnihub.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.ReservationStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Резервирование кредитов под единицу генерации.
 * Закрывается ровно одной операцией settle или refund.
 */
@Table(value = "credit_reservations", schema = "omnihub")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CreditReservation {

    @Id
    private Long id;

    @Column("generation_id")
    private Long generationId;

    @Column("source_type")
    private CreditSourceType sourceType;

    @Column("user_id")
    private Long userId;

    @Column("workspace_id")
    private Long workspaceId;

    /**
     * Зарезервированная сумма.
     */
    private BigDecimal amount;

    /**
     * Фактически списанная сумма (заполняется при settle).
     */
    @Column("settled_amount")
    private BigDecimal settledAmount;

    @Builder.Default
    private ReservationStatus status = ReservationStatus.RESERVED;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column("updated_at")
    private LocalDateTime updatedAt;
}
