package ru.oparin.omnihub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.exception.InvalidRequestException;
import ru.oparin.omnihub.model.dto.catalog.ModelDTO;
import ru.oparin.omnihub.model.dto.catalog.ModelOption;
import ru.oparin.omnihub.model.dto.catalog.ResolvedModel;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.enums.GenerationType;
import ru.oparin.omnihub.repository.AiModelRepository;
import ru.oparin.omnihub.service.provider.ProviderRouter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Каталог моделей.
 * <p>
 * Запись модели разбирается и связывается с адаптером один раз, результат кешируется.
 * Повторное связывание происходит только после истечения записи в кеше.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelCatalogService {

    /**
     * Количество токенов, для которого показывается цена чат-модели в каталоге.
     */
    private static final int CHAT_PRICE_TOKENS = 1000;

    private static final TypeReference<LinkedHashMap<String, ModelOption>> OPTIONS_TYPE = new TypeReference<>() {};

    private final AiModelRepository aiModelRepository;
    private final ProviderRouter providerRouter;
    private final PricingSettingsService pricingSettingsService;
    private final PricingCalculator pricingCalculator;
    private final ObjectMapper objectMapper;
    private final Cache<String, ResolvedModel> resolvedModelsCache;

    /**
     * Получить включенную модель, связанную с адаптером.
     *
     * @param modelId идентификатор модели
     * @return модель или {@link InvalidRequestException}, если модель неизвестна или выключена
     */
    public Mono<ResolvedModel> getModel(String modelId) {
        ResolvedModel cached = resolvedModelsCache.getIfPresent(modelId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return aiModelRepository.findById(modelId)
                .filter(model -> Boolean.TRUE.equals(model.getEnabled()))
                .switchIfEmpty(Mono.error(() -> new InvalidRequestException("Модель недоступна: " + modelId)))
                .map(this::resolve);
    }

    /**
     * Список включенных моделей с ценой одной единицы результата.
     *
     * @param type тип генерации или null для всех моделей
     */
    public Flux<ModelDTO> listModels(GenerationType type) {
        Flux<AiModel> models = type == null
                ? aiModelRepository.findByEnabledTrueOrderByDisplayOrderAsc()
                : aiModelRepository.findByTypeAndEnabledTrueOrderByDisplayOrderAsc(type);
        return pricingSettingsService.getSettings()
                .flatMapMany(settings -> models
                        .map(model -> toDTO(model, parseOptions(model), settings)));
    }

    /**
     * Запись модели независимо от того, включена ли модель сейчас.
     * Нужна для опроса задач, отправленных до выключения модели.
     */
    public Mono<AiModel> findRecord(String modelId) {
        ResolvedModel cached = resolvedModelsCache.getIfPresent(modelId);
        if (cached != null) {
            return Mono.just(cached.getModel());
        }
        return aiModelRepository.findById(modelId);
    }

    private ResolvedModel resolve(AiModel model) {
        ResolvedModel resolved = providerRouter.resolve(model, parseOptions(model));
        resolvedModelsCache.put(model.getId(), resolved);
        return resolved;
    }

    Map<String, ModelOption> parseOptions(AiModel model) {
        if (model.getOptionsJson() == null || model.getOptionsJson().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(model.getOptionsJson(), OPTIONS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Некорректная схема параметров модели {}: {}", model.getId(), e.getOriginalMessage());
            return Map.of();
        }
    }

    private ModelDTO toDTO(AiModel model, Map<String, ModelOption> options, PricingSettings settings) {
        BigDecimal credits = model.getType() == GenerationType.CHAT
                ? pricingCalculator.chatCredits(model, options, Map.of(), CHAT_PRICE_TOKENS, CHAT_PRICE_TOKENS, settings)
                : pricingCalculator.estimate(model, options, Map.of(), 1, settings);
        return ModelDTO.builder()
                .id(model.getId())
                .name(model.getName())
                .type(model.getType())
                .provider(model.getProvider() != null ? model.getProvider().getCode() : null)
                .credits(credits)
                .options(options)
                .build();
    }
}
