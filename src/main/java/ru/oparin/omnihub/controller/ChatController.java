package ru.oparin.omnihub.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.dto.chat.ChatRq;
import ru.oparin.omnihub.model.dto.chat.ChatStreamEvent;
import ru.oparin.omnihub.service.ChatGenerationService;
import ru.oparin.omnihub.util.SecurityUtil;

import java.util.Map;

/**
 * Потоковые ответы чат-моделей (Server-Sent Events).
 */
@Slf4j
@RestController
@RequestMapping("/chat")
@RequiredArgsConstructor
@Tag(name = "Chat", description = "Потоковый чат с оплатой по фактическим токенам")
@SecurityRequirement(name = "bearerAuth")
public class ChatController {

    private final ChatGenerationService chatGenerationService;

    /**
     * Открыть поток ответа. Имя SSE-события совпадает с типом события: start, content, done, error.
     *
     * @param request сообщения и модель
     * @return поток событий
     */
    @Operation(summary = "Получить ответ чат-модели потоком",
            description = "Резервирует кредиты по верхней оценке, транслирует ответ и списывает стоимость фактических токенов")
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ChatStreamEvent>> stream(@Valid @RequestBody ChatRq request) {
        return SecurityUtil.getCurrentUserId()
                .flatMapMany(userId -> chatGenerationService.streamChat(request, userId))
                .map(event -> ServerSentEvent.<ChatStreamEvent>builder()
                        .event(event.getType())
                        .data(event)
                        .build());
    }

    @Operation(summary = "Остановить поток ответа",
            description = "Уже полученная часть ответа сохраняется и оплачивается по фактическим токенам")
    @PostMapping("/{generationId}/stop")
    public Mono<ResponseEntity<Map<String, Object>>> stop(@PathVariable Long generationId) {
        return SecurityUtil.getCurrentUserId()
                .flatMap(userId -> chatGenerationService.stopChat(generationId, userId))
                .map(stopped -> ResponseEntity.ok(Map.<String, Object>of(
                        "generationId", generationId,
                        "stopped", stopped)));
    }
}
