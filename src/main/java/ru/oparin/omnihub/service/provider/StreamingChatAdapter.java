package ru.oparin.omnihub.service.provider;

import reactor.core.publisher.Flux;
import ru.oparin.omnihub.model.dto.provider.ChatChunk;
import ru.oparin.omnihub.model.dto.provider.ChatProviderRequest;
import ru.oparin.omnihub.model.enums.AdapterKind;

/**
 * Адаптер потоковых чат-моделей.
 */
public interface StreamingChatAdapter extends GenerationAdapter {

    /**
     * Открыть поток ответа. Поток содержит приращения текста и завершается фрагментом
     * с количеством токенов. Отмена подписки закрывает соединение с провайдером.
     *
     * @param request запрос
     * @return поток фрагментов
     */
    Flux<ChatChunk> open(ChatProviderRequest request);

    @Override
    default AdapterKind getKind() {
        return AdapterKind.STREAMING;
    }
}
