package ru.oparin.omnihub.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.dto.generation.GenerateRq;
import ru.oparin.omnihub.model.dto.pricing.CostEstimateRs;
import ru.oparin.omnihub.service.GenerationOrchestrator;

@RestController
@RequestMapping("/pricing")
@RequiredArgsConstructor
@Tag(name = "Pricing", description = "Предварительный расчет стоимости")
public class PricingController {

    private final GenerationOrchestrator generationOrchestrator;

    @Operation(summary = "Рассчитать стоимость запроса",
            description = "Возвращает кредиты, которые будут зарезервированы по каждой модели. Кредиты не резервируются")
    @PostMapping("/estimate")
    public Mono<ResponseEntity<CostEstimateRs>> estimate(@Valid @RequestBody GenerateRq request) {
        return generationOrchestrator.estimate(request)
                .map(ResponseEntity::ok);
    }
}
