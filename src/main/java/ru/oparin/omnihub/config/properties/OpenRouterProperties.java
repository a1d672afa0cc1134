package ru.oparin.omnihub.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки OpenRouter (OpenAI-совместимый API чат-моделей), префикс openrouter.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "openrouter")
public class OpenRouterProperties {

    private ProviderApiProperties api = new ProviderApiProperties();

    /**
     * Значение заголовка HTTP-Referer, которым OpenRouter атрибутирует запросы.
     */
    private String referer;

    /**
     * Значение заголовка X-Title.
     */
    private String title = "OmniHub";
}
