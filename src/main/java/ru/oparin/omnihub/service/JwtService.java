package ru.oparin.omnihub.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.omnihub.config.properties.JwtProperties;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Проверка JWT, выпущенных сервисом аутентификации.
 * Токены здесь не выпускаются: из подписанного токена извлекается только идентификатор пользователя.
 */
@Slf4j
@Service
public class JwtService {

    public static final String USER_ID_CLAIM = "userId";

    private final SecretKey key;

    public JwtService(JwtProperties jwtProperties) {
        this.key = Keys.hmacShaKeyFor(jwtProperties.getSecret().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Проверить подпись и срок действия токена и извлечь идентификатор пользователя.
     *
     * @param token JWT без префикса Bearer
     * @return идентификатор пользователя или пустой результат для невалидного токена
     */
    public Optional<Long> extractUserId(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            Long userId = claims.get(USER_ID_CLAIM, Long.class);
            if (userId == null && claims.getSubject() != null && claims.getSubject().matches("\\d+")) {
                userId = Long.valueOf(claims.getSubject());
            }
            if (userId == null) {
                log.warn("В JWT нет идентификатора пользователя");
            }
            return Optional.ofNullable(userId);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Невалидный JWT: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
