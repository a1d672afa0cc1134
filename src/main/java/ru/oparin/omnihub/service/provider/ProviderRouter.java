package ru.oparin.omnihub.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.exception.ConfigurationException;
import ru.oparin.omnihub.exception.ProviderException;
import ru.oparin.omnihub.model.dto.catalog.ModelOption;
import ru.oparin.omnihub.model.dto.catalog.ResolvedModel;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.enums.AdapterKind;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр адаптеров и маршрутизация запросов к ним.
 * <p>
 * Адаптеры индексируются по паре (провайдер, вариант). Для модели вариант выбирается по типу:
 * видео - асинхронный, чат - потоковый, изображения - синхронный, а при его отсутствии асинхронный.
 * Синхронные запросы при недоступности основного провайдера один раз направляются резервному.
 * Провайдер, помеченный {@link ProviderHealthTracker} неработоспособным, пропускается,
 * если у модели есть работоспособный резервный.
 */
@Slf4j
@Service
public class ProviderRouter {

    private final Map<AdapterKind, Map<GenerationProvider, GenerationAdapter>> adapters = new EnumMap<>(AdapterKind.class);
    private final ProviderHealthTracker healthTracker;

    public ProviderRouter(List<GenerationAdapter> adapterBeans, ProviderHealthTracker healthTracker) {
        this.healthTracker = healthTracker;
        for (AdapterKind kind : AdapterKind.values()) {
            adapters.put(kind, new EnumMap<>(GenerationProvider.class));
        }
        adapterBeans.forEach(adapter -> {
            adapters.get(adapter.getKind()).put(adapter.getProvider(), adapter);
            log.info("Зарегистрирован адаптер {} провайдера {}, доступен: {}",
                    adapter.getKind(), adapter.getProvider(), adapter.isAvailable());
        });
    }

    /**
     * Связать модель каталога с адаптером.
     *
     * @param model   запись каталога
     * @param options разобранная схема параметров
     * @return модель с адаптером
     * @throws ConfigurationException если для провайдера модели нет адаптера подходящего варианта
     */
    public ResolvedModel resolve(AiModel model, Map<String, ModelOption> options) {
        if (model.getProvider() == null) {
            throw new ConfigurationException("У модели " + model.getId() + " не указан провайдер");
        }
        AdapterKind kind = selectKind(model);
        GenerationAdapter adapter = find(kind, model.getProvider())
                .orElseThrow(() -> new ConfigurationException(String.format(
                        ProviderConstants.ErrorMessages.ADAPTER_NOT_FOUND, kind, model.getProvider())));

        GenerationAdapter fallback = null;
        if (kind == AdapterKind.SYNCHRONOUS && model.getFallbackProvider() != null
                && model.getFallbackProvider() != model.getProvider()) {
            fallback = find(AdapterKind.SYNCHRONOUS, model.getFallbackProvider()).orElse(null);
            if (fallback == null) {
                log.warn("Резервный провайдер {} модели {} не поддерживает синхронную генерацию, резерв отключен",
                        model.getFallbackProvider(), model.getId());
            }
        }

        log.debug("Модель {} связана с адаптером {} провайдера {}", model.getId(), kind, model.getProvider());
        return ResolvedModel.builder()
                .model(model)
                .options(options)
                .kind(kind)
                .adapter(adapter)
                .fallbackAdapter(fallback)
                .build();
    }

    /**
     * Выполнить синхронную генерацию с однократным переключением на резервного провайдера
     * при недоступности основного.
     *
     * @param model   связанная модель
     * @param request запрос
     * @return результат основного или резервного провайдера
     */
    public Mono<GenerationResult> submitSynchronous(ResolvedModel model, ProviderRequest request) {
        SynchronousGenerationAdapter primary = model.adapter(SynchronousGenerationAdapter.class);
        SynchronousGenerationAdapter fallback = usableFallback(model);
        if (fallback != null && !healthTracker.isHealthy(primary.getProvider())
                && healthTracker.isHealthy(fallback.getProvider())) {
            log.warn("Провайдер {} помечен неработоспособным, запрос единицы {} направлен резервному {}",
                    primary.getProvider(), request.getGenerationId(), fallback.getProvider());
            return submitTracked(fallback, request);
        }
        return submitTracked(primary, request)
                .onErrorResume(error -> {
                    if (!requiresFallback(error) || fallback == null) {
                        return Mono.error(error);
                    }
                    log.warn("Провайдер {} не смог выполнить запрос единицы {}, переключаемся на резервный {}: {}",
                            primary.getProvider(), request.getGenerationId(), fallback.getProvider(), error.getMessage());
                    return submitTracked(fallback, request)
                            .doOnSuccess(result -> log.info("Резервный провайдер {} выполнил запрос единицы {}",
                                    fallback.getProvider(), request.getGenerationId()))
                            .doOnError(fallbackError -> log.warn("Резервный провайдер {} также не смог выполнить запрос единицы {}: {}",
                                    fallback.getProvider(), request.getGenerationId(), fallbackError.getMessage()));
                });
    }

    /**
     * Асинхронный адаптер провайдера (для опроса и webhook).
     */
    public Optional<AsynchronousGenerationAdapter> findAsynchronous(GenerationProvider provider) {
        return find(AdapterKind.ASYNCHRONOUS, provider).map(AsynchronousGenerationAdapter.class::cast);
    }

    private Optional<GenerationAdapter> find(AdapterKind kind, GenerationProvider provider) {
        return Optional.ofNullable(adapters.get(kind).get(provider));
    }

    private AdapterKind selectKind(AiModel model) {
        return switch (model.getType()) {
            case VIDEO -> AdapterKind.ASYNCHRONOUS;
            case CHAT -> AdapterKind.STREAMING;
            case IMAGE -> find(AdapterKind.SYNCHRONOUS, model.getProvider()).isPresent()
                    ? AdapterKind.SYNCHRONOUS
                    : AdapterKind.ASYNCHRONOUS;
        };
    }

    private SynchronousGenerationAdapter usableFallback(ResolvedModel model) {
        GenerationAdapter fallback = model.getFallbackAdapter();
        return fallback != null && fallback.isAvailable() ? (SynchronousGenerationAdapter) fallback : null;
    }

    private Mono<GenerationResult> submitTracked(SynchronousGenerationAdapter adapter, ProviderRequest request) {
        return adapter.submit(request)
                .doOnSuccess(result -> healthTracker.markSuccess(adapter.getProvider()))
                .doOnError(error -> {
                    if (requiresFallback(error)) {
                        healthTracker.markFailure(adapter.getProvider());
                    }
                });
    }

    private boolean requiresFallback(Throwable error) {
        return error instanceof ProviderException providerException
                && providerException.getErrorType() == GenerationErrorType.PROVIDER_UNAVAILABLE;
    }
}
