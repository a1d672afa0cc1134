package ru.oparin.omnihub.model.dto.provider;

import lombok.Value;
import ru.oparin.omnihub.model.enums.GenerationProvider;

/**
 * Идентификатор асинхронной задачи у провайдера.
 * Webhook и опрос сопоставляются с единицей генерации по паре (provider, jobId).
 */
@Value
public class JobHandle {

    GenerationProvider provider;

    String jobId;

    /**
     * Путь модели у провайдера, нужен для построения URL статуса.
     */
    String endpoint;

    /**
     * Позиция в очереди сразу после отправки (если провайдер ее сообщает).
     */
    Integer queuePosition;

    public JobHandle(GenerationProvider provider, String jobId, String endpoint, Integer queuePosition) {
        this.provider = provider;
        this.jobId = jobId;
        this.endpoint = endpoint;
        this.queuePosition = queuePosition;
    }

    public JobHandle(GenerationProvider provider, String jobId, String endpoint) {
        this(provider, jobId, endpoint, null);
    }
}
