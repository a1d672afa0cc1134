package ru.oparin.omnihub.model.enums;

/**
 * Нормализованное состояние асинхронной задачи у провайдера.
 */
public enum JobState {

    /**
     * Задача ожидает в очереди провайдера.
     */
    QUEUED,

    /**
     * Задача выполняется.
     */
    RUNNING,

    /**
     * Задача успешно завершена, результат доступен.
     */
    SUCCEEDED,

    /**
     * Задача завершилась ошибкой.
     */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Статус единицы генерации, соответствующий нетерминальному состоянию задачи.
     */
    public GenerationStatus toGenerationStatus() {
        return switch (this) {
            case QUEUED -> GenerationStatus.QUEUED;
            case RUNNING -> GenerationStatus.RUNNING;
            case SUCCEEDED -> GenerationStatus.COMPLETED;
            case FAILED -> GenerationStatus.FAILED;
        };
    }
}
