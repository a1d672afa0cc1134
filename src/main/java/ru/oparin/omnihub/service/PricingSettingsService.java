package ru.oparin.omnihub.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.config.DatabaseConfig;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;
import ru.oparin.omnihub.model.entity.AppSetting;
import ru.oparin.omnihub.repository.AppSettingRepository;

import java.math.BigDecimal;
import java.util.Map;
import java.util.function.Function;

/**
 * Чтение настроек ценообразования из таблицы app_settings.
 * <p>
 * Настройки ведет административная часть. Здесь они собираются в неизменяемый снимок,
 * который кешируется на период обновления и передается в калькулятор явно.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingSettingsService {

    public static final String PROFIT_MARGIN = "profitMargin";
    public static final String PROFIT_MARGIN_IMAGE = "profitMarginImage";
    public static final String PROFIT_MARGIN_VIDEO = "profitMarginVideo";
    public static final String PROFIT_MARGIN_CHAT = "profitMarginChat";
    public static final String CREDIT_PRICE = "creditPrice";
    public static final String FREE_CREDITS = "freeCredits";

    private static final String CACHE_KEY = "pricing";

    private final AppSettingRepository appSettingRepository;
    private final Cache<String, PricingSettings> pricingSettingsCache;

    /**
     * Получить текущий снимок настроек.
     *
     * @return снимок из кеша или свежепрочитанный из базы
     */
    public Mono<PricingSettings> getSettings() {
        PricingSettings cached = pricingSettingsCache.getIfPresent(CACHE_KEY);
        if (cached != null) {
            return Mono.just(cached);
        }
        return DatabaseConfig.withRetry(appSettingRepository.findAll()
                        .collectMap(AppSetting::getKey, Function.identity()))
                .map(this::toSettings)
                .doOnNext(settings -> {
                    pricingSettingsCache.put(CACHE_KEY, settings);
                    log.debug("Снимок настроек ценообразования обновлен: {}", settings);
                });
    }

    private PricingSettings toSettings(Map<String, AppSetting> rows) {
        PricingSettings defaults = PricingSettings.builder().build();
        return PricingSettings.builder()
                .profitMargin(decimal(rows, PROFIT_MARGIN, defaults.getProfitMargin()))
                .profitMarginImage(decimal(rows, PROFIT_MARGIN_IMAGE, defaults.getProfitMarginImage()))
                .profitMarginVideo(decimal(rows, PROFIT_MARGIN_VIDEO, defaults.getProfitMarginVideo()))
                .profitMarginChat(decimal(rows, PROFIT_MARGIN_CHAT, defaults.getProfitMarginChat()))
                .creditPrice(decimal(rows, CREDIT_PRICE, defaults.getCreditPrice()))
                .freeCredits(decimal(rows, FREE_CREDITS, defaults.getFreeCredits()))
                .build();
    }

    private BigDecimal decimal(Map<String, AppSetting> rows, String key, BigDecimal defaultValue) {
        AppSetting row = rows.get(key);
        if (row == null || row.getValue() == null || row.getValue().isBlank()) {
            return defaultValue;
        }
        try {
            return new BigDecimal(row.getValue().trim());
        } catch (NumberFormatException e) {
            log.warn("Некорректное значение настройки {}: '{}', используется {}", key, row.getValue(), defaultValue);
            return defaultValue;
        }
    }
}
