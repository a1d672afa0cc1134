package ru.oparin.omnihub.exception;

import lombok.Getter;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;

/**
 * Нормализованная ошибка провайдера.
 * Оркестратор опирается только на {@link #getErrorType()}, а не на конкретного провайдера.
 */
@Getter
public class ProviderException extends GenerationException {

    private final GenerationProvider provider;

    /**
     * HTTP статус ответа провайдера (null для ошибок подключения и таймаутов).
     */
    private final Integer httpStatus;

    public ProviderException(GenerationErrorType errorType, GenerationProvider provider, String message) {
        this(errorType, provider, message, null, null);
    }

    public ProviderException(GenerationErrorType errorType, GenerationProvider provider, String message,
                             Integer httpStatus, Throwable cause) {
        super(errorType, message, cause);
        this.provider = provider;
        this.httpStatus = httpStatus;
    }
}
