package ru.oparin.omnihub.model.dto.catalog;

import lombok.Builder;
import lombok.Value;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.enums.AdapterKind;
import ru.oparin.omnihub.service.provider.GenerationAdapter;

import java.util.Map;

/**
 * Модель каталога, связанная со своим адаптером.
 * Связывание выполняется один раз при загрузке модели, а не при каждом вызове.
 */
@Value
@Builder
public class ResolvedModel {

    AiModel model;

    /**
     * Разобранная схема параметров.
     */
    Map<String, ModelOption> options;

    AdapterKind kind;

    GenerationAdapter adapter;

    /**
     * Резервный адаптер (только для синхронных моделей, может быть null).
     */
    GenerationAdapter fallbackAdapter;

    public String getId() {
        return model.getId();
    }

    /**
     * Адаптер нужного варианта. Вариант проверяется при связывании, поэтому приведение безопасно.
     */
    public <T extends GenerationAdapter> T adapter(Class<T> type) {
        return type.cast(adapter);
    }
}
