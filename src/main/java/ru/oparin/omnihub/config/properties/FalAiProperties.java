package ru.oparin.omnihub.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурационные свойства для интеграции с Fal.ai API.
 * Настройки загружаются из application.yml с префиксом fal.ai.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "fal.ai")
public class FalAiProperties {

    /**
     * Синхронный API (https://fal.run).
     */
    private ProviderApiProperties api = new ProviderApiProperties();

    /**
     * URL системы очередей (https://queue.fal.run).
     */
    private String queueUrl = "https://queue.fal.run";
}
