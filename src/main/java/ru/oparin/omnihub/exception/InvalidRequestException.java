package ru.oparin.omnihub.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Запрос отклонен до создания единиц генерации (неизвестная модель, превышен лимит моделей и т.п.).
 */
@Getter
public class InvalidRequestException extends RuntimeException {

    private final HttpStatus status;

    public InvalidRequestException(String message) {
        super(message);
        this.status = HttpStatus.BAD_REQUEST;
    }
}
