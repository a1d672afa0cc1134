package ru.oparin.omnihub.model.dto.credit;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.LedgerOperation;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запись журнала кредитов")
public class LedgerEntryDTO {

    private Long id;

    private Long generationId;

    private LedgerOperation operation;

    private CreditSourceType source;

    private BigDecimal amount;

    private BigDecimal balanceAfter;

    private LocalDateTime createdAt;
}
