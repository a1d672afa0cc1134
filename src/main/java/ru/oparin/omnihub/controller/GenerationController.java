package ru.oparin.omnihub.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.exception.GenerationException;
import ru.oparin.omnihub.exception.InvalidRequestException;
import ru.oparin.omnihub.model.dto.generation.GenerateRq;
import ru.oparin.omnihub.model.dto.generation.GenerationBatchRs;
import ru.oparin.omnihub.model.dto.generation.GenerationUnitDTO;
import ru.oparin.omnihub.service.GenerationOrchestrator;
import ru.oparin.omnihub.util.SecurityUtil;

import java.util.List;

/**
 * Генерация изображений и видео одной или несколькими моделями.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Generation", description = "Генерация изображений и видео, в том числе сравнение нескольких моделей")
@SecurityRequirement(name = "bearerAuth")
public class GenerationController {

    private final GenerationOrchestrator generationOrchestrator;

    /**
     * Принять запрос на генерацию. Единицы выполняются в фоне, клиент опрашивает их статус.
     *
     * @param request запрос генерации
     * @return correlationId и начальные статусы единиц
     */
    @Operation(summary = "Запустить генерацию",
            description = "Создает по одной единице генерации на каждую модель и сразу возвращает их идентификаторы")
    @PostMapping("/generate")
    public Mono<ResponseEntity<GenerationBatchRs>> generate(@Valid @RequestBody GenerateRq request) {
        return SecurityUtil.getCurrentUserId()
                .flatMap(userId -> generationOrchestrator.submit(request, userId))
                .map(batch -> ResponseEntity.status(HttpStatus.ACCEPTED).body(batch))
                .doOnError(error -> {
                    if (error instanceof GenerationException || error instanceof InvalidRequestException) {
                        log.warn("Запрос генерации отклонен: {}", error.getMessage());
                    } else {
                        log.error("Ошибка при запуске генерации", error);
                    }
                });
    }

    @Operation(summary = "Получить статус единицы генерации")
    @GetMapping("/generation/{id}")
    public Mono<ResponseEntity<GenerationUnitDTO>> getUnit(@PathVariable Long id) {
        return SecurityUtil.getCurrentUserId()
                .flatMap(userId -> generationOrchestrator.getUnit(id, userId))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Получить все единицы запроса",
            description = "Возвращает единицы генерации, созданные одним запросом (общий correlationId)")
    @GetMapping("/generation/batch/{correlationId}")
    public Mono<ResponseEntity<GenerationBatchRs>> getBatch(@PathVariable String correlationId) {
        return SecurityUtil.getCurrentUserId()
                .flatMap(userId -> generationOrchestrator.getBatch(correlationId, userId))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Получить незавершенные генерации пользователя")
    @GetMapping("/generation/active")
    public Mono<ResponseEntity<List<GenerationUnitDTO>>> getActiveUnits() {
        return SecurityUtil.getCurrentUserId()
                .flatMap(userId -> generationOrchestrator.getActiveUnits(userId).collectList())
                .map(ResponseEntity::ok);
    }
}
