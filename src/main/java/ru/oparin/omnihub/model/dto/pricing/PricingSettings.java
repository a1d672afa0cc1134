package ru.oparin.omnihub.model.dto.pricing;

import lombok.Builder;
import lombok.Value;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.math.BigDecimal;

/**
 * Неизменяемый снимок настроек ценообразования.
 * Снимок передается в калькулятор явно при каждом расчете.
 */
@Value
@Builder
public class PricingSettings {

    /**
     * Универсальная наценка в процентах.
     */
    @Builder.Default
    BigDecimal profitMargin = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal profitMarginImage = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal profitMarginVideo = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal profitMarginChat = BigDecimal.ZERO;

    /**
     * Цена одного кредита в USD.
     */
    @Builder.Default
    BigDecimal creditPrice = BigDecimal.ONE;

    /**
     * Кредиты, начисляемые новому пользователю.
     */
    @Builder.Default
    BigDecimal freeCredits = BigDecimal.TEN;

    /**
     * Наценка для типа генерации: отдельная наценка типа, если она ненулевая, иначе универсальная.
     */
    public BigDecimal effectiveMargin(GenerationType type) {
        BigDecimal typeMargin = switch (type) {
            case IMAGE -> profitMarginImage;
            case VIDEO -> profitMarginVideo;
            case CHAT -> profitMarginChat;
        };
        if (typeMargin != null && typeMargin.signum() != 0) {
            return typeMargin;
        }
        return profitMargin != null ? profitMargin : BigDecimal.ZERO;
    }
}
