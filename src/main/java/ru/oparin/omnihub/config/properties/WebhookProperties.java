package ru.oparin.omnihub.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки приема webhook от провайдеров (префикс app.webhook).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.webhook")
public class WebhookProperties {

    /**
     * Публичный адрес приложения, на который провайдеры присылают webhook.
     * Если не задан, асинхронные задачи отслеживаются только опросом.
     */
    private String publicBaseUrl;

    public boolean isEnabled() {
        return publicBaseUrl != null && !publicBaseUrl.isBlank();
    }

    /**
     * Полный URL webhook для провайдера.
     *
     * @param providerCode код провайдера (fal, replicate)
     */
    public String callbackUrl(String providerCode) {
        String base = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        return base + "/webhooks/" + providerCode;
    }
}
