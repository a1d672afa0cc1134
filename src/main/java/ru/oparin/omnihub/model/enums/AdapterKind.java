package ru.oparin.omnihub.model.enums;

/**
 * Способ взаимодействия адаптера с провайдером.
 */
public enum AdapterKind {

    /**
     * Результат возвращается в рамках одного вызова (большинство моделей изображений).
     */
    SYNCHRONOUS,

    /**
     * Задача в очереди провайдера, завершение через webhook или опрос (видео).
     */
    ASYNCHRONOUS,

    /**
     * Поток токенов (чат-модели).
     */
    STREAMING
}
