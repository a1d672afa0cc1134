package ru.oparin.omnihub.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.omnihub.config.properties.GenerationProperties;
import ru.oparin.omnihub.model.dto.catalog.ResolvedModel;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Конфигурация кеширования для приложения.
 */
@Configuration
public class CacheConfig {

    /**
     * Снимок настроек ценообразования. Перечитывается из базы не реже периода обновления.
     */
    @Bean
    public Cache<String, PricingSettings> pricingSettingsCache(GenerationProperties generationProperties) {
        return Caffeine.newBuilder()
                .maximumSize(1) // Только один снимок
                .expireAfterWrite(Duration.ofSeconds(generationProperties.getSettingsRefreshSeconds()))
                .build();
    }

    /**
     * Модели каталога, связанные с адаптерами, с TTL 5 минут.
     */
    @Bean
    public Cache<String, ResolvedModel> resolvedModelsCache() {
        return Caffeine.newBuilder()
                .maximumSize(500)
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .build();
    }
}
