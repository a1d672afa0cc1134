package ru.oparin.omnihub.model.dto.provider;

import lombok.Value;

/**
 * Разобранный webhook провайдера.
 * Если {@link #status} равен null, провайдер сообщил только о завершении,
 * и результат нужно запросить через опрос статуса.
 */
@Value
public class WebhookEvent {

    String jobId;

    JobStatus status;
}
