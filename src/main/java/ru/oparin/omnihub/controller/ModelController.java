package ru.oparin.omnihub.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.exception.InvalidRequestException;
import ru.oparin.omnihub.model.dto.catalog.ModelDTO;
import ru.oparin.omnihub.model.enums.GenerationType;
import ru.oparin.omnihub.service.ModelCatalogService;

import java.util.List;

@RestController
@RequestMapping("/models")
@RequiredArgsConstructor
@Tag(name = "Models", description = "Каталог доступных моделей")
public class ModelController {

    private final ModelCatalogService modelCatalogService;

    @Operation(summary = "Список доступных моделей",
            description = "Возвращает включенные модели с параметрами и ценой в кредитах, опционально по типу")
    @GetMapping
    public Mono<ResponseEntity<List<ModelDTO>>> listModels(
            @Parameter(description = "image, video или chat") @RequestParam(required = false) String type) {
        return Flux.defer(() -> modelCatalogService.listModels(parseType(type)))
                .collectList()
                .map(ResponseEntity::ok);
    }

    private GenerationType parseType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        try {
            return GenerationType.fromCode(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }
}
