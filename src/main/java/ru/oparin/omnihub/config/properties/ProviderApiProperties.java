package ru.oparin.omnihub.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Общие настройки HTTP API провайдера: адрес, ключ, таймауты и повторы.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ProviderApiProperties {

    /**
     * Базовый URL API.
     */
    private String url;

    /**
     * API ключ. Провайдер без ключа считается недоступным.
     */
    private String key;

    /**
     * Таймаут ответа в секундах.
     */
    private long timeoutSeconds = 300;

    /**
     * Количество повторов при временной недоступности провайдера.
     */
    private int retryAttempts = 3;

    /**
     * Начальная задержка между повторами в миллисекундах (дальше растет экспоненциально).
     */
    private long retryDelayMs = 1000;

    public boolean hasKey() {
        return key != null && !key.isBlank();
    }
}
