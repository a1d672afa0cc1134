package ru.oparin.omnihub.model.dto.credit;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.omnihub.model.enums.CreditSourceType;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Баланс источника кредитов")
public class BalanceRs {

    private CreditSourceType source;

    private Long workspaceId;

    private BigDecimal balance;
}
