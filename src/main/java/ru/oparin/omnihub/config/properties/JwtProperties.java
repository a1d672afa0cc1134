package ru.oparin.omnihub.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки проверки JWT, выпущенных сервисом аутентификации (префикс jwt).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    /**
     * Общий секрет подписи HS256 (не короче 32 байт).
     */
    private String secret;
}
