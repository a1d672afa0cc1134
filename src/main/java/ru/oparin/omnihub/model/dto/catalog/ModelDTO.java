package ru.oparin.omnihub.model.dto.catalog;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Модель каталога с параметрами")
public class ModelDTO {

    @Schema(description = "Идентификатор модели", example = "flux-schnell")
    private String id;

    @Schema(description = "Название модели", example = "FLUX Schnell")
    private String name;

    @Schema(description = "Тип модели", example = "image")
    private GenerationType type;

    @Schema(description = "Код провайдера", example = "fal")
    private String provider;

    @Schema(description = "Стоимость одной единицы результата в кредитах с учетом наценки (для чата - за 1K входных и 1K выходных токенов)")
    private BigDecimal credits;

    @Schema(description = "Параметры модели")
    private Map<String, ModelOption> options;
}
