package ru.oparin.omnihub.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.omnihub.model.enums.GenerationErrorType;

/**
 * Ошибка генерации с категорией из фиксированной таксономии.
 * Сообщение исключения предназначено для логов, пользователю показывается {@link #getUserMessage()}.
 */
@Getter
public class GenerationException extends RuntimeException {

    private final GenerationErrorType errorType;
    private final HttpStatus status;

    public GenerationException(GenerationErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
        this.status = errorType.getHttpStatus();
    }

    public GenerationException(GenerationErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.status = errorType.getHttpStatus();
    }

    public String getUserMessage() {
        return errorType.getUserMessage();
    }
}
