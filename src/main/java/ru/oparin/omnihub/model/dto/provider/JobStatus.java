package ru.oparin.omnihub.model.dto.provider;

import lombok.Value;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.model.enums.JobState;

/**
 * Нормализованное состояние асинхронной задачи.
 */
@Value
public class JobStatus {

    JobState state;

    Integer queuePosition;

    /**
     * Результат (только для SUCCEEDED).
     */
    GenerationResult result;

    /**
     * Ошибка (только для FAILED).
     */
    ProviderException error;

    public static JobStatus queued(Integer queuePosition) {
        return new JobStatus(JobState.QUEUED, queuePosition, null, null);
    }

    public static JobStatus running() {
        return new JobStatus(JobState.RUNNING, null, null, null);
    }

    public static JobStatus succeeded(GenerationResult result) {
        return new JobStatus(JobState.SUCCEEDED, null, result, null);
    }

    public static JobStatus failed(ProviderException error) {
        return new JobStatus(JobState.FAILED, null, null, error);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
