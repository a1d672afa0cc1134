package ru.oparin.omnihub.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.config.EnableR2dbcAuditing;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Настройка R2DBC: аудит дат создания и изменения, репозитории.
 * Менеджер реактивных транзакций создается автоконфигурацией Spring Boot.
 */
@Configuration
@EnableR2dbcAuditing
@EnableR2dbcRepositories(basePackages = "ru.oparin.omnihub.repository")
public class DatabaseConfig {

    /**
     * Повторить чтение при кратковременной потере связи с БД.
     * Только для идемпотентных чтений: изменения баланса не повторяются.
     */
    public static <T> Mono<T> withRetry(Mono<T> mono) {
        return mono.retryWhen(Retry.backoff(3, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(5))
                .jitter(0.1));
    }
}
