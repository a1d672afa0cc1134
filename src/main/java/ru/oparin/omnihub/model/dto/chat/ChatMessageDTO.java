package ru.oparin.omnihub.model.dto.chat;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Сообщение чата")
public class ChatMessageDTO {

    @NotBlank
    @Schema(description = "Роль: system, user или assistant", example = "user")
    private String role;

    @NotBlank
    @Schema(description = "Текст сообщения", example = "Привет!")
    private String content;
}
