package ru.oparin.omnihub.model.dto.generation;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.util.List;
import java.util.Map;

/**
 * Запрос на генерацию. Несколько моделей означают параллельное сравнение (fan-out).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запрос на генерацию изображения или видео одной или несколькими моделями")
public class GenerateRq {

    @NotEmpty(message = "Нужно указать хотя бы одну модель")
    @Schema(description = "Идентификаторы моделей", example = "[\"flux-schnell\"]")
    private List<String> models;

    @NotNull(message = "Тип генерации обязателен")
    @Schema(description = "Тип генерации", example = "image")
    private GenerationType type;

    @NotBlank(message = "Промпт не может быть пустым")
    @Schema(description = "Описание результата (промпт)", example = "астронавт верхом на лошади")
    private String prompt;

    @Schema(description = "URL входных изображений (img2img, img2video)")
    private List<String> inputImageUrls;

    /**
     * Параметры по моделям: id модели → (ключ параметра → значение).
     */
    @Schema(description = "Параметры по моделям: id модели → параметры")
    private Map<String, Map<String, Object>> options;

    @Builder.Default
    @Min(value = 1, message = "Количество должно быть не меньше 1")
    @Max(value = 4, message = "Количество должно быть не больше 4")
    @Schema(description = "Количество результатов", example = "1")
    private Integer quantity = 1;

    @Schema(description = "Идентификатор workspace (null - личный)")
    private Long workspaceId;
}
