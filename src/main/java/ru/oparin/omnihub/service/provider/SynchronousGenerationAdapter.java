package ru.oparin.omnihub.service.provider;

import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.enums.AdapterKind;

/**
 * Адаптер, возвращающий результат в рамках одного вызова (модели изображений).
 */
public interface SynchronousGenerationAdapter extends GenerationAdapter {

    /**
     * Выполнить генерацию. Временная недоступность провайдера повторяется внутри адаптера.
     *
     * @param request запрос
     * @return результат или {@link ru.oparin.omnihub.exception.ProviderException}
     */
    Mono<GenerationResult> submit(ProviderRequest request);

    @Override
    default AdapterKind getKind() {
        return AdapterKind.SYNCHRONOUS;
    }
}
