package ru.oparin.omnihub.model.dto.generation;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ответ на запрос генерации: идентификатор группы и единицы по моделям")
public class GenerationBatchRs {

    @Schema(description = "Идентификатор группы единиц одного запроса")
    private String correlationId;

    private List<GenerationUnitDTO> units;
}
