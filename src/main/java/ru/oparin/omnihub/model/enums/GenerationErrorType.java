package ru.oparin.omnihub.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Фиксированная таксономия ошибок генерации.
 * <p>
 * Провайдеры нормализуют свои ошибки в эти категории, поэтому оркестратор
 * никогда не ветвится по конкретному провайдеру. Пользователь видит только
 * {@link #getUserMessage()}, а не сырой текст ошибки провайдера.
 */
@Getter
@RequiredArgsConstructor
public enum GenerationErrorType {

    INSUFFICIENT_CREDITS("Недостаточно кредитов для генерации", HttpStatus.PAYMENT_REQUIRED),

    PROVIDER_UNAVAILABLE("Сервис генерации временно недоступен. Попробуйте позже.", HttpStatus.SERVICE_UNAVAILABLE),

    PROVIDER_REJECTED("Сервис генерации отклонил запрос. Проверьте промпт и параметры.", HttpStatus.UNPROCESSABLE_ENTITY),

    TIMEOUT("Превышено время ожидания ответа от сервиса генерации", HttpStatus.GATEWAY_TIMEOUT),

    CANCELLED("Генерация отменена", HttpStatus.OK),

    CONFIGURATION_ERROR("Генерация недоступна из-за ошибки конфигурации", HttpStatus.INTERNAL_SERVER_ERROR),

    INTERNAL_INVARIANT_VIOLATION("Не удалось выполнить генерацию", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String userMessage;
    private final HttpStatus httpStatus;

    /**
     * Повторяется ли ошибка автоматически на уровне адаптера.
     */
    public boolean isRetryable() {
        return this == PROVIDER_UNAVAILABLE;
    }

    public static GenerationErrorType fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return GenerationErrorType.valueOf(value);
        } catch (IllegalArgumentException e) {
            return INTERNAL_INVARIANT_VIOLATION;
        }
    }
}
