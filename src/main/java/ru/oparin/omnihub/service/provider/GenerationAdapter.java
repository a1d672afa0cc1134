package ru.oparin.omnihub.service.provider;

import ru.oparin.omnihub.model.enums.AdapterKind;
import ru.oparin.omnihub.model.enums.GenerationProvider;

/**
 * Общий контракт адаптера провайдера.
 * <p>
 * Адаптер переводит общий запрос в вызов конкретного API и нормализует ответ и ошибки
 * (в {@link ru.oparin.omnihub.exception.ProviderException}). Конкретный вариант
 * определяется способом получения результата:
 * <ul>
 *   <li>{@link SynchronousGenerationAdapter} - результат в рамках одного вызова</li>
 *   <li>{@link AsynchronousGenerationAdapter} - задача в очереди, webhook или опрос</li>
 *   <li>{@link StreamingChatAdapter} - поток токенов</li>
 * </ul>
 */
public interface GenerationAdapter {

    GenerationProvider getProvider();

    AdapterKind getKind();

    /**
     * Базовая проверка доступности (наличие API ключа).
     */
    boolean isAvailable();
}
