package ru.oparin.omnihub.model.dto.chat;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запрос потокового ответа чат-модели")
public class ChatRq {

    @NotBlank(message = "Модель обязательна")
    @Schema(description = "Идентификатор чат-модели", example = "gpt-4o-mini")
    private String model;

    @Valid
    @NotEmpty(message = "Нужно передать хотя бы одно сообщение")
    private List<ChatMessageDTO> messages;

    @Schema(description = "Параметры модели")
    private Map<String, Object> options;

    @Schema(description = "Ограничение на количество выходных токенов")
    private Integer maxTokens;

    @Schema(description = "Идентификатор workspace (null - личный)")
    private Long workspaceId;
}
