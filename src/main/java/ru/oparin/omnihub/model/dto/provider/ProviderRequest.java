package ru.oparin.omnihub.model.dto.provider;

import lombok.Builder;
import lombok.Value;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.util.List;
import java.util.Map;

/**
 * Запрос к адаптеру провайдера в общем для всех провайдеров виде.
 */
@Value
@Builder
public class ProviderRequest {

    /**
     * Идентификатор единицы генерации (для логов).
     */
    Long generationId;

    String modelId;

    GenerationType type;

    /**
     * Путь модели у провайдера.
     */
    String endpoint;

    String prompt;

    @Builder.Default
    List<String> inputImageUrls = List.of();

    @Builder.Default
    Map<String, Object> options = Map.of();

    @Builder.Default
    int quantity = 1;

    public boolean hasInputImages() {
        return inputImageUrls != null && !inputImageUrls.isEmpty();
    }
}
