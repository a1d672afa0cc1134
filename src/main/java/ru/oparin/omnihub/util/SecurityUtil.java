package ru.oparin.omnihub.util;

import lombok.experimental.UtilityClass;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.exception.AuthException;

/**
 * Утилитный класс для работы с Spring Security.
 */
@UtilityClass
public class SecurityUtil {

    /**
     * Получить ID текущего пользователя из контекста безопасности.
     *
     * @return Mono с ID пользователя или {@link AuthException}, если пользователь не аутентифицирован
     */
    public static Mono<Long> getCurrentUserId() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .map(Authentication::getPrincipal)
                .filter(Long.class::isInstance)
                .map(Long.class::cast)
                .switchIfEmpty(Mono.error(AuthException::unauthorized));
    }
}
