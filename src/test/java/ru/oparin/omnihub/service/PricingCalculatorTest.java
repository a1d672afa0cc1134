package ru.oparin.omnihub.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.oparin.omnihub.exception.ConfigurationException;
import ru.oparin.omnihub.model.dto.catalog.ModelOption;
import ru.oparin.omnihub.model.dto.catalog.OptionChoice;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PricingCalculator")
class PricingCalculatorTest {

    private final PricingCalculator calculator = new PricingCalculator();

    private static final PricingSettings NO_MARGIN = PricingSettings.builder().build();

    @Test
    @DisplayName("flux-schnell без наценки при цене кредита 1.0 стоит ровно базовую стоимость")
    void baseCostWithoutMargin() {
        AiModel model = imageModel(new BigDecimal("0.003"));

        BigDecimal credits = calculator.estimate(model, Map.of(), Map.of(), 1, NO_MARGIN);

        assertThat(credits).isEqualByComparingTo("0.003");
    }

    @Test
    @DisplayName("Вариант по умолчанию с множителем не удорожает запрос без выбранных параметров")
    void defaultChoiceIsIncludedInBaseCost() {
        AiModel model = imageModel(new BigDecimal("0.003"));
        Map<String, ModelOption> options = Map.of("image_size",
                option("landscape_16_9", choice("square_hd", "1"), choice("landscape_16_9", "1.3")));

        assertThat(calculator.estimate(model, options, Map.of(), 1, NO_MARGIN)).isEqualByComparingTo("0.003");
        assertThat(calculator.estimate(model, options, Map.of("image_size", "landscape_16_9"), 1, NO_MARGIN))
                .isEqualByComparingTo("0.0039");
    }

    @Test
    @DisplayName("Наценка и цена кредита применяются к стоимости всех результатов")
    void marginAndCreditPrice() {
        PricingSettings settings = PricingSettings.builder()
                .profitMargin(new BigDecimal("50"))
                .creditPrice(new BigDecimal("0.01"))
                .build();

        BigDecimal credits = calculator.calculate(new BigDecimal("0.02"), BigDecimal.ONE, 2, GenerationType.IMAGE, settings);

        // 0.02 * 2 * 1.5 / 0.01
        assertThat(credits).isEqualByComparingTo("6");
        assertThat(credits.scale()).isEqualTo(PricingCalculator.CREDIT_SCALE);
    }

    @Test
    @DisplayName("Ненулевая наценка типа заменяет универсальную, нулевая - нет")
    void typeMarginOverridesUniversal() {
        PricingSettings settings = PricingSettings.builder()
                .profitMargin(new BigDecimal("10"))
                .profitMarginVideo(new BigDecimal("100"))
                .build();

        BigDecimal video = calculator.calculate(BigDecimal.ONE, BigDecimal.ONE, 1, GenerationType.VIDEO, settings);
        BigDecimal image = calculator.calculate(BigDecimal.ONE, BigDecimal.ONE, 1, GenerationType.IMAGE, settings);

        assertThat(video).isEqualByComparingTo("2");
        assertThat(image).isEqualByComparingTo("1.1");
    }

    @Test
    @DisplayName("Рост наценки на изображения с 0% до 20% строго увеличивает стоимость")
    void imageMarginStrictlyIncreasesCredits() {
        AiModel model = imageModel(new BigDecimal("0.0125"));
        PricingSettings withoutMargin = PricingSettings.builder().profitMarginImage(BigDecimal.ZERO).build();
        PricingSettings withMargin = PricingSettings.builder().profitMarginImage(new BigDecimal("20")).build();

        BigDecimal before = calculator.estimate(model, Map.of(), Map.of(), 1, withoutMargin);
        BigDecimal after = calculator.estimate(model, Map.of(), Map.of(), 1, withMargin);

        assertThat(after).isGreaterThan(before);
        assertThat(after).isEqualByComparingTo("0.015");
    }

    @Test
    @DisplayName("Неположительная цена кредита - ошибка конфигурации")
    void nonPositiveCreditPrice() {
        PricingSettings zero = PricingSettings.builder().creditPrice(BigDecimal.ZERO).build();
        PricingSettings negative = PricingSettings.builder().creditPrice(new BigDecimal("-1")).build();

        assertThatThrownBy(() -> calculator.calculate(BigDecimal.ONE, BigDecimal.ONE, 1, GenerationType.IMAGE, zero))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> calculator.calculate(BigDecimal.ONE, BigDecimal.ONE, 1, GenerationType.IMAGE, negative))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Множители берутся только у параметров, переданных в запросе")
    void optionMultiplierCoversSelectedOnly() {
        Map<String, ModelOption> options = new LinkedHashMap<>();
        options.put("image_size", option("square", choice("square", null), choice("landscape_16_9", "1.5")));
        options.put("resolution", option("1080p", choice("720p", "1"), choice("1080p", "2")));

        assertThat(calculator.optionMultiplier(options, Map.of())).isEqualByComparingTo("1");
        assertThat(calculator.optionMultiplier(options, Map.of("image_size", "landscape_16_9"))).isEqualByComparingTo("1.5");
        assertThat(calculator.optionMultiplier(options, Map.of("image_size", "landscape_16_9", "resolution", "1080p")))
                .isEqualByComparingTo("3");
        assertThat(calculator.optionMultiplier(options, Map.of("seed", 42))).isEqualByComparingTo("1");
        assertThat(calculator.optionMultiplier(null, Map.of("resolution", "720p"))).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("Стоимость чата считается по тысячам входных и выходных токенов")
    void chatCredits() {
        AiModel model = AiModel.builder()
                .id("gpt-4o-mini")
                .type(GenerationType.CHAT)
                .provider(GenerationProvider.OPENROUTER)
                .inputCost(new BigDecimal("0.15"))
                .outputCost(new BigDecimal("0.6"))
                .build();

        BigDecimal credits = calculator.chatCredits(model, Map.of(), Map.of(), 2000, 500, NO_MARGIN);

        // 2 * 0.15 + 0.5 * 0.6
        assertThat(credits).isEqualByComparingTo("0.6");
        assertThat(calculator.estimateChatCredits(model, Map.of(), Map.of(), 2000, 4096, NO_MARGIN))
                .isGreaterThan(credits);
    }

    @Test
    @DisplayName("Неполный результат оплачивается пропорционально резерву")
    void prorate() {
        assertThat(calculator.prorate(new BigDecimal("0.4"), 3, 4)).isEqualByComparingTo("0.3");
        assertThat(calculator.prorate(new BigDecimal("0.4"), 4, 4)).isEqualByComparingTo("0.4");
        assertThat(calculator.prorate(new BigDecimal("0.4"), 0, 4)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Оценка токенов: четыре символа на токен с округлением вверх")
    void estimateTokens() {
        assertThat(PricingCalculator.estimateTokens(null)).isZero();
        assertThat(PricingCalculator.estimateTokens("")).isZero();
        assertThat(PricingCalculator.estimateTokens("abcd")).isEqualTo(1);
        assertThat(PricingCalculator.estimateTokens("abcde")).isEqualTo(2);
    }

    @Test
    @DisplayName("Верхняя граница токенов не меньше количества байт UTF-8")
    void maxTokens() {
        assertThat(PricingCalculator.maxTokens(null)).isZero();
        assertThat(PricingCalculator.maxTokens("abcd")).isEqualTo(4);
        assertThat(PricingCalculator.maxTokens("Привет")).isEqualTo(12);
        assertThat(PricingCalculator.maxTokens("Привет, как дела?"))
                .isGreaterThan(PricingCalculator.estimateTokens("Привет, как дела?"));
    }

    private static AiModel imageModel(BigDecimal baseCost) {
        return AiModel.builder()
                .id("flux-schnell")
                .type(GenerationType.IMAGE)
                .provider(GenerationProvider.FAL_AI)
                .endpoint("fal-ai/flux/schnell")
                .baseCost(baseCost)
                .build();
    }

    private static ModelOption option(String defaultValue, OptionChoice... choices) {
        return ModelOption.builder()
                .type("select")
                .defaultValue(defaultValue)
                .choices(List.of(choices))
                .build();
    }

    private static OptionChoice choice(String value, String multiplier) {
        return OptionChoice.builder()
                .value(value)
                .priceMultiplier(multiplier != null ? new BigDecimal(multiplier) : null)
                .build();
    }
}
