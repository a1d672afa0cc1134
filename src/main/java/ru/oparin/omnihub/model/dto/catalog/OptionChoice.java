package ru.oparin.omnihub.model.dto.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Вариант значения параметра модели.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Вариант значения параметра модели")
public class OptionChoice {

    @Schema(description = "Значение, передаваемое провайдеру", example = "landscape_16_9")
    private String value;

    @Schema(description = "Подпись для отображения", example = "1344×768")
    private String label;

    /**
     * Множитель цены при выборе этого варианта (null означает 1.0).
     */
    @Schema(description = "Множитель цены", example = "1.3")
    private BigDecimal priceMultiplier;
}
