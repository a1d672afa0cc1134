package ru.oparin.omnihub.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.LedgerOperation;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Запись журнала кредитов. Журнал только дополняется.
 * <p>
 * Сумма {@link #balanceDelta} по источнику равна изменению кэшированного баланса этого источника.
 */
@Table(value = "ledger_entries", schema = "omnihub")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {

    @Id
    private Long id;

    @Column("generation_id")
    private Long generationId;

    @Column("reservation_id")
    private Long reservationId;

    @Column("source_type")
    private CreditSourceType sourceType;

    @Column("user_id")
    private Long userId;

    @Column("workspace_id")
    private Long workspaceId;

    private LedgerOperation operation;

    /**
     * Сумма операции (всегда неотрицательная).
     */
    private BigDecimal amount;

    /**
     * Изменение доступного баланса источника: минус при резерве, плюс при возврате.
     */
    @Column("balance_delta")
    private BigDecimal balanceDelta;

    @Column("balance_after")
    private BigDecimal balanceAfter;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;
}
