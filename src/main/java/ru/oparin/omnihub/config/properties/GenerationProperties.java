package ru.oparin.omnihub.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки оркестрации генераций.
 * Загружаются из application.yml с префиксом app.generation.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.generation")
public class GenerationProperties {

    /**
     * Максимальное количество моделей в одном запросе (fan-out).
     */
    private int maxModelsPerRequest = 4;

    /**
     * Максимальное количество результатов одной модели.
     */
    private int maxQuantity = 4;

    /**
     * Интервал опроса статуса асинхронной задачи в миллисекундах.
     */
    private long pollIntervalMs = 3000;

    /**
     * Время ожидания асинхронной задачи по умолчанию, если у модели не задано свое.
     */
    private int defaultMaxWaitSeconds = 600;

    /**
     * Верхняя граница выходных токенов для оценки стоимости чата.
     */
    private int chatMaxOutputTokens = 4096;

    /**
     * Служебные токены на одно сообщение чата (роль, разделители), добавляемые к верхней оценке входа.
     */
    private int chatMessageOverheadTokens = 8;

    /**
     * Период обновления снимка настроек ценообразования в секундах.
     */
    private long settingsRefreshSeconds = 30;

    /**
     * Настройки планировщика, доводящего зависшие асинхронные генерации.
     */
    private Watchdog watchdog = new Watchdog();

    /**
     * Учет работоспособности провайдеров для синхронной маршрутизации.
     */
    private ProviderHealth providerHealth = new ProviderHealth();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderHealth {

        /**
         * Сколько ошибок недоступности подряд переводят провайдера в неработоспособные.
         */
        private int failureThreshold = 3;

        /**
         * Через сколько секунд после последней ошибки провайдеру снова отправляются запросы.
         */
        private long recoverySeconds = 300;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Watchdog {

        private boolean enabled = true;

        /**
         * Интервал запуска в миллисекундах.
         */
        private long intervalMs = 60_000;

        /**
         * Через сколько секунд без изменений отправленная задача считается зависшей.
         */
        private long staleAfterSeconds = 120;

        /**
         * Через сколько секунд активная единица без задачи у провайдера считается брошенной
         * (например, после перезапуска посреди синхронного вызова) и завершается с возвратом кредитов.
         */
        private long abandonedAfterSeconds = 900;
    }
}
