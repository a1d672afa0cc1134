package ru.oparin.omnihub.model.dto.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Событие потокового ответа чата.
 * Поток начинается событием start, продолжается событиями content
 * и завершается ровно одним событием done или error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Событие потока чата")
public class ChatStreamEvent {

    public static final String START = "start";
    public static final String CONTENT = "content";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    @Schema(description = "Тип события: start, content, done, error")
    private String type;

    private Long generationId;

    @Schema(description = "Фрагмент ответа (content)")
    private String content;

    @Schema(description = "Списанные кредиты (done)")
    private BigDecimal credits;

    @Schema(description = "Баланс источника после списания (done)")
    private BigDecimal balance;

    @Schema(description = "Ответ был прерван пользователем (done)")
    private Boolean stopped;

    @Schema(description = "Описание ошибки (error)")
    private String error;

    public static ChatStreamEvent start(Long generationId) {
        return ChatStreamEvent.builder().type(START).generationId(generationId).build();
    }

    public static ChatStreamEvent content(Long generationId, String content) {
        return ChatStreamEvent.builder().type(CONTENT).generationId(generationId).content(content).build();
    }

    public static ChatStreamEvent error(Long generationId, String error) {
        return ChatStreamEvent.builder().type(ERROR).generationId(generationId).error(error).build();
    }
}
