package ru.oparin.omnihub.model.dto.pricing;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Предварительная стоимость генерации")
public class CostEstimateRs {

    @Schema(description = "Кредиты по моделям")
    private Map<String, BigDecimal> credits;

    @Schema(description = "Итого кредитов")
    private BigDecimal total;
}
