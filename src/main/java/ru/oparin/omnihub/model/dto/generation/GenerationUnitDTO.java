package ru.oparin.omnihub.model.dto.generation;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Состояние единицы генерации для фронтенда.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Единица генерации (одна модель)")
public class GenerationUnitDTO {

    private Long id;

    private String correlationId;

    private String modelId;

    private GenerationType type;

    private GenerationStatus status;

    @Schema(description = "Позиция в очереди провайдера (для асинхронных генераций)")
    private Integer queuePosition;

    @Schema(description = "URL результатов (заполняется при COMPLETED)")
    private List<String> resultUrls;

    @Schema(description = "Текст результата (чат)")
    private String text;

    @Schema(description = "Списанные кредиты (заполняется при COMPLETED)")
    private BigDecimal credits;

    private CreditSourceType creditSource;

    @Schema(description = "Категория ошибки (заполняется при FAILED)")
    private GenerationErrorType errorType;

    @Schema(description = "Понятное пользователю описание ошибки")
    private String errorMessage;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;
}
