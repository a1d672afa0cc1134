package ru.oparin.omnihub.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.service.GenerationOrchestrator;

/**
 * Прием webhook от провайдеров асинхронных генераций.
 * Ответ всегда 200: провайдер не должен повторять доставку из-за наших ошибок обработки.
 */
@Slf4j
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Уведомления провайдеров о завершении задач")
public class WebhookController {

    private final GenerationOrchestrator generationOrchestrator;
    private final ObjectMapper objectMapper;

    @Operation(summary = "Принять webhook провайдера")
    @PostMapping("/{provider}")
    public Mono<ResponseEntity<Void>> receive(@PathVariable String provider,
                                              @RequestBody(required = false) String body) {
        GenerationProvider generationProvider = GenerationProvider.fromCode(provider);
        if (generationProvider == null) {
            log.warn("Webhook от неизвестного провайдера '{}' проигнорирован", provider);
            return Mono.just(ResponseEntity.ok().build());
        }
        if (body == null || body.isBlank()) {
            log.warn("Пустой webhook от {} проигнорирован", generationProvider);
            return Mono.just(ResponseEntity.ok().build());
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Webhook от {} с некорректным JSON проигнорирован: {}", generationProvider, e.getOriginalMessage());
            return Mono.just(ResponseEntity.ok().build());
        }

        return generationOrchestrator.handleWebhook(generationProvider, payload)
                .thenReturn(ResponseEntity.ok().<Void>build());
    }
}
