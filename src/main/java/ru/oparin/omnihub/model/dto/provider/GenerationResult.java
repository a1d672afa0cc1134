package ru.oparin.omnihub.model.dto.provider;

import lombok.Builder;
import lombok.Value;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.util.List;

/**
 * Нормализованный результат генерации.
 */
@Value
@Builder(toBuilder = true)
public class GenerationResult {

    /**
     * Провайдер, фактически выполнивший генерацию (может быть резервным).
     */
    GenerationProvider provider;

    @Builder.Default
    List<String> urls = List.of();

    /**
     * Текстовый результат (чат).
     */
    String text;

    Long seed;

    /**
     * Количество фактически полученных результатов. Используется для расчета итоговой стоимости.
     */
    public int producedCount() {
        return urls == null ? 0 : urls.size();
    }
}
