package ru.oparin.omnihub.service;

import org.springframework.stereotype.Component;
import ru.oparin.omnihub.exception.ConfigurationException;
import ru.oparin.omnihub.model.dto.catalog.ModelOption;
import ru.oparin.omnihub.model.dto.catalog.OptionChoice;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.enums.GenerationType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Перевод стоимости провайдера в кредиты.
 * <p>
 * credits = (baseCost × множители параметров × quantity) × (1 + наценка / 100) / цена кредита.
 * <p>
 * Калькулятор не хранит состояния: все входные данные, включая снимок настроек, передаются в вызов.
 */
@Component
public class PricingCalculator {

    public static final int CREDIT_SCALE = 8;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final int CHARS_PER_TOKEN = 4;

    /**
     * Рассчитать кредиты по базовой стоимости.
     *
     * @param baseCost      стоимость провайдера в USD за единицу результата
     * @param multiplier    произведение множителей выбранных параметров
     * @param quantity      количество результатов
     * @param type          тип генерации (для выбора наценки)
     * @param settings      снимок настроек
     * @return кредиты, округленные до 8 знаков
     * @throws ConfigurationException если цена кредита не положительна
     */
    public BigDecimal calculate(BigDecimal baseCost, BigDecimal multiplier, int quantity,
                                GenerationType type, PricingSettings settings) {
        BigDecimal creditPrice = settings.getCreditPrice();
        if (creditPrice == null || creditPrice.signum() <= 0) {
            throw new ConfigurationException("Цена кредита должна быть положительной, получено: " + creditPrice);
        }
        BigDecimal cost = nonNull(baseCost)
                .multiply(multiplier != null ? multiplier : BigDecimal.ONE)
                .multiply(BigDecimal.valueOf(quantity));
        BigDecimal withMargin = cost.multiply(BigDecimal.ONE.add(settings.effectiveMargin(type).divide(HUNDRED)));
        return withMargin.divide(creditPrice, CREDIT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Кредиты за генерацию изображений или видео моделью каталога.
     *
     * @param model    модель
     * @param options  схема параметров модели
     * @param selected выбранные значения параметров
     * @param quantity количество результатов
     * @param settings снимок настроек
     */
    public BigDecimal estimate(AiModel model, Map<String, ModelOption> options, Map<String, Object> selected,
                               int quantity, PricingSettings settings) {
        return calculate(model.getBaseCost(), optionMultiplier(options, selected), quantity, model.getType(), settings);
    }

    /**
     * Произведение множителей цены выбранных параметров.
     * Учитываются только параметры, явно переданные в запросе: значение по умолчанию входит в базовую цену.
     * Параметр вне схемы модели и вариант без множителя дают 1.0.
     */
    public BigDecimal optionMultiplier(Map<String, ModelOption> options, Map<String, Object> selected) {
        if (options == null || options.isEmpty() || selected == null || selected.isEmpty()) {
            return BigDecimal.ONE;
        }
        BigDecimal result = BigDecimal.ONE;
        for (Map.Entry<String, Object> entry : selected.entrySet()) {
            ModelOption option = options.get(entry.getKey());
            if (option == null || entry.getValue() == null) {
                continue;
            }
            BigDecimal multiplier = option.findChoice(entry.getValue())
                    .map(OptionChoice::getPriceMultiplier)
                    .orElse(null);
            if (multiplier != null) {
                result = result.multiply(multiplier);
            }
        }
        return result;
    }

    /**
     * Стоимость чата у провайдера в USD по количеству токенов.
     */
    public BigDecimal chatCost(AiModel model, int inputTokens, int outputTokens) {
        BigDecimal input = BigDecimal.valueOf(inputTokens).multiply(nonNull(model.getInputCost()));
        BigDecimal output = BigDecimal.valueOf(outputTokens).multiply(nonNull(model.getOutputCost()));
        return input.add(output).divide(THOUSAND, CREDIT_SCALE * 2, RoundingMode.HALF_UP);
    }

    /**
     * Фактические кредиты за ответ чата.
     */
    public BigDecimal chatCredits(AiModel model, Map<String, ModelOption> options, Map<String, Object> selected,
                                  int inputTokens, int outputTokens, PricingSettings settings) {
        return calculate(chatCost(model, inputTokens, outputTokens), optionMultiplier(options, selected),
                1, GenerationType.CHAT, settings);
    }

    /**
     * Верхняя оценка кредитов за ответ чата, резервируемая перед открытием потока.
     */
    public BigDecimal estimateChatCredits(AiModel model, Map<String, ModelOption> options, Map<String, Object> selected,
                                          int inputTokens, int maxOutputTokens, PricingSettings settings) {
        return chatCredits(model, options, selected, inputTokens, maxOutputTokens, settings);
    }

    /**
     * Фактическая стоимость, если провайдер вернул меньше результатов, чем было запрошено.
     * Цена берется из резерва, поэтому смена настроек во время генерации на списание не влияет.
     *
     * @param reserved  зарезервированные кредиты за весь запрос
     * @param produced  количество полученных результатов
     * @param requested запрошенное количество
     */
    public BigDecimal prorate(BigDecimal reserved, int produced, int requested) {
        if (reserved == null || requested <= 0 || produced >= requested) {
            return reserved;
        }
        if (produced <= 0) {
            return BigDecimal.ZERO;
        }
        return reserved.multiply(BigDecimal.valueOf(produced))
                .divide(BigDecimal.valueOf(requested), CREDIT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Приблизительное количество токенов в тексте: четыре символа на токен с округлением вверх.
     * Используется, только если провайдер не сообщил фактическое количество.
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Верхняя граница количества токенов в тексте для резерва.
     * Байтовый BPE-токенизатор не дает больше токенов, чем байт в UTF-8 представлении текста.
     */
    public static int maxTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
