package ru.oparin.omnihub.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.model.dto.provider.JobHandle;
import ru.oparin.omnihub.model.dto.provider.JobStatus;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.dto.provider.WebhookEvent;
import ru.oparin.omnihub.model.enums.AdapterKind;

import java.util.Optional;

/**
 * Адаптер задач в очереди провайдера (модели видео).
 * Завершение наблюдается через webhook или опрос {@link #status(JobHandle)}.
 */
public interface AsynchronousGenerationAdapter extends GenerationAdapter {

    /**
     * Поставить задачу в очередь провайдера.
     *
     * @param request запрос
     * @return идентификатор задачи
     */
    Mono<JobHandle> submit(ProviderRequest request);

    /**
     * Запросить текущее состояние задачи.
     *
     * @param handle идентификатор задачи
     * @return нормализованное состояние
     */
    Mono<JobStatus> status(JobHandle handle);

    /**
     * Разобрать тело webhook.
     *
     * @param payload тело webhook
     * @return событие или пустой результат, если тело не распознано
     */
    Optional<WebhookEvent> parseWebhook(JsonNode payload);

    @Override
    default AdapterKind getKind() {
        return AdapterKind.ASYNCHRONOUS;
    }
}
