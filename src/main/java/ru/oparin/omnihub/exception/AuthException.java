package ru.oparin.omnihub.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Ошибка аутентификации или доступа к чужим ресурсам (workspace, генерации).
 */
@Getter
public class AuthException extends RuntimeException {

    private final HttpStatus status;

    public AuthException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public static AuthException unauthorized() {
        return new AuthException(HttpStatus.UNAUTHORIZED, "Требуется аутентификация");
    }

    public static AuthException forbidden(String message) {
        return new AuthException(HttpStatus.FORBIDDEN, message);
    }
}
