package ru.oparin.omnihub.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.config.properties.GenerationProperties;
import ru.oparin.omnihub.exception.GenerationException;
import ru.oparin.omnihub.exception.InvalidRequestException;
import ru.oparin.omnihub.exception.NotFoundException;
import ru.oparin.omnihub.mapper.GenerationMapper;
import ru.oparin.omnihub.mapper.JsonColumnMapper;
import ru.oparin.omnihub.model.dto.catalog.ModelOption;
import ru.oparin.omnihub.model.dto.catalog.ResolvedModel;
import ru.oparin.omnihub.model.dto.credit.CreditSource;
import ru.oparin.omnihub.model.dto.generation.GenerateRq;
import ru.oparin.omnihub.model.dto.generation.GenerationBatchRs;
import ru.oparin.omnihub.model.dto.generation.GenerationUnitDTO;
import ru.oparin.omnihub.model.dto.pricing.CostEstimateRs;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.JobHandle;
import ru.oparin.omnihub.model.dto.provider.JobStatus;
import ru.oparin.omnihub.model.dto.provider.ProviderRequest;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.entity.Generation;
import ru.oparin.omnihub.model.enums.AdapterKind;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.model.enums.GenerationType;
import ru.oparin.omnihub.model.enums.JobState;
import ru.oparin.omnihub.repository.GenerationRepository;
import ru.oparin.omnihub.service.provider.AsynchronousGenerationAdapter;
import ru.oparin.omnihub.service.provider.ProviderRouter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Оркестратор генераций изображений и видео.
 * <p>
 * Запрос с несколькими моделями превращается в независимые единицы с общим correlationId.
 * Каждая единица проходит PENDING → RESERVING → DISPATCHED (QUEUED/RUNNING) → COMPLETED | FAILED
 * сама по себе: ошибка одной единицы не отменяет соседние. Терминальный переход выполняет
 * {@link GenerationUnitService}, он же закрывает резерв кредитов.
 * <p>
 * Асинхронная единица завершается первым из событий: webhook, результат опроса или таймаут.
 */
@Slf4j
@Service
public class GenerationOrchestrator {

    private final GenerationRepository generationRepository;
    private final GenerationUnitService unitService;
    private final CreditLedgerService creditLedgerService;
    private final ModelCatalogService modelCatalogService;
    private final PricingSettingsService pricingSettingsService;
    private final PricingCalculator pricingCalculator;
    private final ProviderRouter providerRouter;
    private final GenerationProperties generationProperties;
    private final JsonColumnMapper jsonColumnMapper;
    private final GenerationMapper generationMapper;

    public GenerationOrchestrator(GenerationRepository generationRepository,
                                  GenerationUnitService unitService,
                                  CreditLedgerService creditLedgerService,
                                  ModelCatalogService modelCatalogService,
                                  PricingSettingsService pricingSettingsService,
                                  PricingCalculator pricingCalculator,
                                  ProviderRouter providerRouter,
                                  GenerationProperties generationProperties,
                                  JsonColumnMapper jsonColumnMapper,
                                  GenerationMapper generationMapper) {
        this.generationRepository = generationRepository;
        this.unitService = unitService;
        this.creditLedgerService = creditLedgerService;
        this.modelCatalogService = modelCatalogService;
        this.pricingSettingsService = pricingSettingsService;
        this.pricingCalculator = pricingCalculator;
        this.providerRouter = providerRouter;
        this.generationProperties = generationProperties;
        this.jsonColumnMapper = jsonColumnMapper;
        this.generationMapper = generationMapper;
    }

    /**
     * Принять запрос: проверить его, создать единицы по моделям и запустить их выполнение.
     * Ответ возвращается сразу после создания единиц, не дожидаясь провайдеров.
     *
     * @param request запрос
     * @param userId  пользователь
     * @return correlationId и начальное состояние единиц
     */
    public Mono<GenerationBatchRs> submit(GenerateRq request, Long userId) {
        return Mono.defer(() -> prepare(request, userId))
                .flatMap(prepared -> {
                    log.info("Запрос генерации {} пользователя {}: {} моделей {}, источник {}",
                            prepared.correlationId(), userId, prepared.plans().size(),
                            prepared.plans().stream().map(plan -> plan.model().getId()).toList(), prepared.source());

                    dispatchBatch(prepared.plans(), prepared.source(), prepared.settings())
                            .subscribe(
                                    unit -> log.debug("Единица {} запроса {} обработана: {}",
                                            unit.getId(), prepared.correlationId(), unit.getStatus()),
                                    error -> log.error("Ошибка обработки запроса генерации {}", prepared.correlationId(), error),
                                    () -> log.info("Все единицы запроса {} отправлены", prepared.correlationId()));

                    return Mono.just(GenerationBatchRs.builder()
                            .correlationId(prepared.correlationId())
                            .units(prepared.plans().stream()
                                    .map(plan -> generationMapper.toUnitDTO(plan.unit()))
                                    .toList())
                            .build());
                });
    }

    /**
     * Выполнить единицы запроса конкурентно (не больше лимита моделей одновременно).
     * Поток не завершается ошибкой: ошибка единицы переводит ее в FAILED.
     *
     * @return единицы в том порядке, в котором они вышли из фазы отправки
     */
    public Flux<Generation> dispatchBatch(List<UnitPlan> plans, CreditSource source, PricingSettings settings) {
        return Flux.fromIterable(plans)
                .flatMap(plan -> runUnit(plan, source, settings), generationProperties.getMaxModelsPerRequest());
    }

    /**
     * Стоимость запроса по моделям без резервирования.
     */
    public Mono<CostEstimateRs> estimate(GenerateRq request) {
        return Mono.fromRunnable(() -> validateShape(request))
                .then(pricingSettingsService.getSettings())
                .flatMap(settings -> Flux.fromIterable(new LinkedHashSet<>(request.getModels()))
                        .concatMap(modelCatalogService::getModel)
                        .doOnNext(model -> validateModel(model, request))
                        .collect(LinkedHashMap<String, BigDecimal>::new, (credits, model) ->
                                credits.put(model.getId(), estimateModel(request, model, settings))))
                .map(credits -> CostEstimateRs.builder()
                        .credits(credits)
                        .total(credits.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add))
                        .build());
    }

    private BigDecimal estimateModel(GenerateRq request, ResolvedModel model, PricingSettings settings) {
        Map<String, Object> selected = selectedOptions(request, model.getId());
        if (request.getType() == GenerationType.CHAT) {
            return pricingCalculator.estimateChatCredits(model.getModel(), model.getOptions(), selected,
                    PricingCalculator.maxTokens(request.getPrompt()) + generationProperties.getChatMessageOverheadTokens(),
                    generationProperties.getChatMaxOutputTokens(), settings);
        }
        return pricingCalculator.estimate(model.getModel(), model.getOptions(), selected, request.getQuantity(), settings);
    }

    /**
     * Обработать webhook провайдера. Нераспознанное тело, неизвестная задача и уже завершенная
     * единица молча игнорируются.
     *
     * @param provider провайдер из пути webhook
     * @param payload  тело webhook
     */
    public Mono<Void> handleWebhook(GenerationProvider provider, JsonNode payload) {
        AsynchronousGenerationAdapter adapter = providerRouter.findAsynchronous(provider).orElse(null);
        if (adapter == null) {
            log.warn("Webhook от провайдера {} без асинхронного адаптера проигнорирован", provider);
            return Mono.empty();
        }
        return Mono.justOrEmpty(adapter.parseWebhook(payload))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Нераспознанный webhook от {} проигнорирован", provider);
                    return Mono.empty();
                }))
                .flatMap(event -> generationRepository.findByProviderAndProviderJobId(provider, event.getJobId())
                        .switchIfEmpty(Mono.defer(() -> {
                            log.warn("Webhook от {} для неизвестной задачи {} проигнорирован", provider, event.getJobId());
                            return Mono.empty();
                        }))
                        .flatMap(unit -> {
                            if (unit.getStatus().isTerminal()) {
                                log.info("Повторный webhook для завершенной генерации {} (задача {}) проигнорирован",
                                        unit.getId(), event.getJobId());
                                return Mono.empty();
                            }
                            log.info("Webhook от {} для генерации {} (задача {})", provider, unit.getId(), event.getJobId());
                            if (event.getStatus() != null) {
                                return applyJobStatus(unit, event.getStatus());
                            }
                            return jobHandle(unit)
                                    .flatMap(adapter::status)
                                    .flatMap(status -> applyJobStatus(unit, status));
                        }))
                .onErrorResume(error -> {
                    log.warn("Ошибка обработки webhook от {}: {}", provider, error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Текущее состояние единицы пользователя.
     */
    public Mono<GenerationUnitDTO> getUnit(Long id, Long userId) {
        return generationRepository.findById(id)
                .filter(unit -> userId.equals(unit.getUserId()))
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Генерация не найдена: " + id)))
                .map(generationMapper::toUnitDTO);
    }

    /**
     * Все единицы одного запроса.
     */
    public Mono<GenerationBatchRs> getBatch(String correlationId, Long userId) {
        return generationRepository.findByCorrelationIdOrderByIdAsc(correlationId)
                .filter(unit -> userId.equals(unit.getUserId()))
                .map(generationMapper::toUnitDTO)
                .collectList()
                .flatMap(units -> units.isEmpty()
                        ? Mono.error(new NotFoundException("Запрос генерации не найден: " + correlationId))
                        : Mono.just(GenerationBatchRs.builder().correlationId(correlationId).units(units).build()));
    }

    /**
     * Незавершенные единицы пользователя (для восстановления прогресса на клиенте).
     */
    public Flux<GenerationUnitDTO> getActiveUnits(Long userId) {
        List<GenerationStatus> active = new ArrayList<>(EnumSet.complementOf(
                EnumSet.of(GenerationStatus.COMPLETED, GenerationStatus.FAILED)));
        return generationRepository.findByUserIdAndStatusInOrderByIdDesc(userId, active)
                .map(generationMapper::toUnitDTO);
    }

    /**
     * Довести зависшие единицы: опросить старые асинхронные задачи, завершить по таймауту
     * те, что ждут дольше допустимого, и вернуть кредиты брошенным единицам без задачи.
     *
     * @return количество единиц, переведенных в терминальный статус
     */
    public Mono<Long> recoverStaleUnits() {
        LocalDateTime now = LocalDateTime.now();
        GenerationProperties.Watchdog watchdog = generationProperties.getWatchdog();

        Flux<Boolean> dispatched = generationRepository
                .findDispatchedStartedBefore(GenerationStatus.dispatchedNames(), now.minusSeconds(watchdog.getStaleAfterSeconds()))
                .concatMap(unit -> recoverDispatched(unit, now));

        Flux<Boolean> abandoned = generationRepository
                .findAbandonedUpdatedBefore(GenerationStatus.activeNames(), now.minusSeconds(watchdog.getAbandonedAfterSeconds()))
                .concatMap(unit -> unitService.fail(unit.getId(), GenerationErrorType.PROVIDER_UNAVAILABLE,
                                "Единица в статусе " + unit.getStatus() + " брошена без задачи у провайдера")
                        .map(saved -> saved.getStatus() == GenerationStatus.FAILED));

        return Flux.concat(dispatched, abandoned)
                .filter(Boolean::booleanValue)
                .count();
    }

    private Mono<Boolean> recoverDispatched(Generation unit, LocalDateTime now) {
        return modelCatalogService.findRecord(unit.getModelId())
                .map(this::maxWait)
                .defaultIfEmpty(Duration.ofSeconds(generationProperties.getDefaultMaxWaitSeconds()))
                .flatMap(maxWait -> {
                    if (unit.getStartedAt() != null && unit.getStartedAt().plus(maxWait).isBefore(now)) {
                        return unitService.fail(unit.getId(), GenerationErrorType.TIMEOUT,
                                        "Задача " + unit.getProviderJobId() + " не завершилась за " + maxWait.toSeconds() + " с")
                                .map(saved -> saved.getStatus().isTerminal());
                    }
                    return pollOnce(unit);
                })
                .onErrorResume(error -> {
                    log.warn("Не удалось опросить задачу {} генерации {}: {}",
                            unit.getProviderJobId(), unit.getId(), error.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<PreparedBatch> prepare(GenerateRq request, Long userId) {
        validateShape(request);
        if (request.getType() == GenerationType.CHAT) {
            return Mono.error(new InvalidRequestException("Для чата используйте потоковый запрос /chat/stream"));
        }
        List<String> modelIds = new ArrayList<>(new LinkedHashSet<>(request.getModels()));

        Mono<List<ResolvedModel>> models = Flux.fromIterable(modelIds)
                .concatMap(modelCatalogService::getModel)
                .doOnNext(model -> validateModel(model, request))
                .collectList();

        return Mono.zip(models,
                        creditLedgerService.resolveSource(userId, request.getWorkspaceId()),
                        pricingSettingsService.getSettings())
                .flatMap(tuple -> {
                    String correlationId = UUID.randomUUID().toString();
                    CreditSource source = tuple.getT2();
                    return Flux.fromIterable(tuple.getT1())
                            .concatMap(model -> {
                                Map<String, Object> selected = selectedOptions(request, model.getId());
                                return createUnit(request, model, userId, source, correlationId)
                                        .map(unit -> new UnitPlan(unit, model, request.getInputImageUrls(),
                                                selected, effectiveOptions(model, selected)));
                            })
                            .collectList()
                            .map(plans -> new PreparedBatch(correlationId, source, tuple.getT3(), plans));
                });
    }

    private void validateShape(GenerateRq request) {
        if (request.getModels() == null || request.getModels().isEmpty()) {
            throw new InvalidRequestException("Нужно указать хотя бы одну модель");
        }
        int distinctModels = new LinkedHashSet<>(request.getModels()).size();
        if (distinctModels > generationProperties.getMaxModelsPerRequest()) {
            throw new InvalidRequestException(String.format("В одном запросе можно указать не больше %d моделей",
                    generationProperties.getMaxModelsPerRequest()));
        }
        if (request.getQuantity() == null || request.getQuantity() < 1
                || request.getQuantity() > generationProperties.getMaxQuantity()) {
            throw new InvalidRequestException(String.format("Количество результатов должно быть от 1 до %d",
                    generationProperties.getMaxQuantity()));
        }
    }

    private void validateModel(ResolvedModel model, GenerateRq request) {
        if (model.getModel().getType() != request.getType()) {
            throw new InvalidRequestException(String.format("Модель %s не поддерживает тип генерации %s",
                    model.getId(), request.getType()));
        }
        Map<String, Object> selected = selectedOptions(request, model.getId());
        selected.forEach((key, value) -> {
            ModelOption option = model.getOptions().get(key);
            if (option != null && option.getChoices() != null && !option.getChoices().isEmpty()
                    && value != null && option.findChoice(value).isEmpty()) {
                throw new InvalidRequestException(String.format("Недопустимое значение '%s' параметра %s модели %s",
                        value, key, model.getId()));
            }
        });
    }

    private Mono<Generation> createUnit(GenerateRq request, ResolvedModel model, Long userId,
                                        CreditSource source, String correlationId) {
        Generation unit = Generation.builder()
                .correlationId(correlationId)
                .userId(userId)
                .workspaceId(source.getWorkspaceId())
                .modelId(model.getId())
                .type(request.getType())
                .prompt(request.getPrompt())
                .inputJson(jsonColumnMapper.write(request.getInputImageUrls()))
                .optionsJson(jsonColumnMapper.write(selectedOptions(request, model.getId())))
                .quantity(request.getQuantity())
                .status(GenerationStatus.PENDING)
                .provider(model.getModel().getProvider())
                .build();
        return generationRepository.save(unit);
    }

    /**
     * Полный жизненный цикл одной единицы. Любая ошибка переводит единицу в FAILED с возвратом резерва.
     */
    private Mono<Generation> runUnit(UnitPlan plan, CreditSource source, PricingSettings settings) {
        Generation unit = plan.unit();
        ResolvedModel model = plan.model();

        return unitService.advance(unit.getId(), List.of(GenerationStatus.PENDING), GenerationStatus.RESERVING)
                .flatMap(advanced -> {
                    if (!advanced) {
                        return generationRepository.findById(unit.getId());
                    }
                    BigDecimal estimated = pricingCalculator.estimate(model.getModel(), model.getOptions(),
                            plan.selectedOptions(), unit.getQuantity(), settings);
                    return creditLedgerService.reserve(source, estimated, unit.getId())
                            .flatMap(reservation -> unitService.markDispatched(unit, reservation)
                                    .doOnNext(dispatched -> {
                                        unit.setEstimatedCredits(reservation.getAmount());
                                        unit.setReservationId(reservation.getId());
                                        unit.setStartedAt(LocalDateTime.now());
                                    }))
                            .flatMap(dispatched -> dispatched
                                    ? dispatch(plan)
                                    : generationRepository.findById(unit.getId()));
                })
                .onErrorResume(error -> failUnit(unit, error));
    }

    private Mono<Generation> dispatch(UnitPlan plan) {
        ProviderRequest request = toProviderRequest(plan);
        if (plan.model().getKind() == AdapterKind.SYNCHRONOUS) {
            return providerRouter.submitSynchronous(plan.model(), request)
                    .flatMap(result -> completeWithResult(plan.unit(), result));
        }
        AsynchronousGenerationAdapter adapter = plan.model().adapter(AsynchronousGenerationAdapter.class);
        return adapter.submit(request)
                .flatMap(handle -> unitService.markSubmitted(plan.unit().getId(), handle)
                        .doOnNext(submitted -> {
                            plan.unit().setProviderJobId(handle.getJobId());
                            plan.unit().setProvider(handle.getProvider());
                        })
                        .thenReturn(handle))
                .flatMap(handle -> awaitCompletion(plan.unit(), handle, adapter, maxWait(plan.model().getModel())));
    }

    /**
     * Ожидание асинхронной задачи: опрос с заданным интервалом, пока единица не станет терминальной
     * (в том числе благодаря webhook), но не дольше максимального времени ожидания модели.
     */
    private Mono<Generation> awaitCompletion(Generation unit, JobHandle handle,
                                             AsynchronousGenerationAdapter adapter, Duration maxWait) {
        Duration pollInterval = Duration.ofMillis(generationProperties.getPollIntervalMs());
        return Flux.interval(pollInterval)
                .concatMap(tick -> generationRepository.findById(unit.getId())
                        .flatMap(current -> {
                            if (current.getStatus().isTerminal()) {
                                return Mono.just(true);
                            }
                            return adapter.status(handle)
                                    .flatMap(status -> applyJobStatus(current, status))
                                    .onErrorResume(error -> {
                                        log.warn("Ошибка опроса задачи {} генерации {}: {}",
                                                handle.getJobId(), unit.getId(), error.getMessage());
                                        return Mono.just(false);
                                    });
                        })
                        .defaultIfEmpty(true))
                .takeUntil(Boolean::booleanValue)
                .then()
                .timeout(maxWait)
                .then(Mono.defer(() -> generationRepository.findById(unit.getId())))
                .onErrorResume(TimeoutException.class, e -> unitService.fail(unit.getId(), GenerationErrorType.TIMEOUT,
                        "Задача " + handle.getJobId() + " не завершилась за " + maxWait.toSeconds() + " с"));
    }

    /**
     * Один опрос задачи единицы (для планировщика).
     *
     * @return true если единица стала терминальной
     */
    private Mono<Boolean> pollOnce(Generation unit) {
        AsynchronousGenerationAdapter adapter = providerRouter.findAsynchronous(unit.getProvider()).orElse(null);
        if (adapter == null) {
            return unitService.fail(unit.getId(), GenerationErrorType.CONFIGURATION_ERROR,
                            "Нет асинхронного адаптера для провайдера " + unit.getProvider())
                    .map(saved -> true);
        }
        return jobHandle(unit)
                .flatMap(adapter::status)
                .flatMap(status -> applyJobStatus(unit, status))
                .defaultIfEmpty(false);
    }

    /**
     * Применить состояние задачи к единице: терминальное завершает ее, иначе обновляется прогресс.
     *
     * @return true если задача терминальна
     */
    private Mono<Boolean> applyJobStatus(Generation unit, JobStatus status) {
        if (status.getState() == JobState.SUCCEEDED) {
            return completeWithResult(unit, status.getResult()).thenReturn(true);
        }
        if (status.getState() == JobState.FAILED) {
            GenerationException error = status.getError();
            GenerationErrorType errorType = error != null ? error.getErrorType() : GenerationErrorType.PROVIDER_REJECTED;
            return unitService.fail(unit.getId(), errorType, error != null ? error.getMessage() : "задача завершилась ошибкой")
                    .thenReturn(true);
        }
        return unitService.updateProgress(unit.getId(), status).thenReturn(false);
    }

    private Mono<Generation> completeWithResult(Generation unit, GenerationResult result) {
        int produced = result.producedCount();
        if (produced == 0) {
            return unitService.fail(unit.getId(), GenerationErrorType.PROVIDER_UNAVAILABLE, "провайдер вернул пустой результат");
        }
        return estimatedCredits(unit)
                .flatMap(estimated -> unitService.complete(unit.getId(), result,
                        pricingCalculator.prorate(estimated, produced, unit.getQuantity())));
    }

    private Mono<BigDecimal> estimatedCredits(Generation unit) {
        if (unit.getEstimatedCredits() != null) {
            return Mono.just(unit.getEstimatedCredits());
        }
        return generationRepository.findById(unit.getId())
                .mapNotNull(Generation::getEstimatedCredits)
                .defaultIfEmpty(BigDecimal.ZERO);
    }

    private Mono<Generation> failUnit(Generation unit, Throwable error) {
        GenerationErrorType errorType = error instanceof GenerationException generationException
                ? generationException.getErrorType()
                : GenerationErrorType.INTERNAL_INVARIANT_VIOLATION;
        if (errorType == GenerationErrorType.INTERNAL_INVARIANT_VIOLATION) {
            log.error("Непредвиденная ошибка генерации {} (модель {})", unit.getId(), unit.getModelId(), error);
        }
        return unitService.fail(unit.getId(), errorType, error.getMessage())
                .onErrorResume(failError -> {
                    log.error("Не удалось завершить генерацию {} ошибкой, ее доведет планировщик", unit.getId(), failError);
                    return Mono.just(unit);
                });
    }

    private Mono<JobHandle> jobHandle(Generation unit) {
        return modelCatalogService.findRecord(unit.getModelId())
                .map(model -> new JobHandle(unit.getProvider(), unit.getProviderJobId(), model.getEndpoint()));
    }

    private ProviderRequest toProviderRequest(UnitPlan plan) {
        Generation unit = plan.unit();
        return ProviderRequest.builder()
                .generationId(unit.getId())
                .modelId(plan.model().getId())
                .type(unit.getType())
                .endpoint(plan.model().getModel().getEndpoint())
                .prompt(unit.getPrompt())
                .inputImageUrls(plan.inputImageUrls() != null ? plan.inputImageUrls() : List.of())
                .options(plan.providerOptions())
                .quantity(unit.getQuantity())
                .build();
    }

    private Duration maxWait(AiModel model) {
        Integer seconds = model.getMaxWaitSeconds();
        return Duration.ofSeconds(seconds != null && seconds > 0 ? seconds : generationProperties.getDefaultMaxWaitSeconds());
    }

    private static Map<String, Object> selectedOptions(GenerateRq request, String modelId) {
        if (request.getOptions() == null || request.getOptions().get(modelId) == null) {
            return Map.of();
        }
        return request.getOptions().get(modelId);
    }

    /**
     * Выбранные параметры, дополненные значениями по умолчанию из схемы модели.
     * Провайдер получает значения явно, а не полагается на свои умолчания.
     */
    private static Map<String, Object> effectiveOptions(ResolvedModel model, Map<String, Object> selected) {
        Map<String, Object> options = new LinkedHashMap<>();
        model.getOptions().forEach((key, option) -> {
            if (option.getDefaultValue() != null) {
                options.put(key, option.getDefaultValue());
            }
        });
        selected.forEach((key, value) -> {
            if (value != null) {
                options.put(key, value);
            }
        });
        return options;
    }

    /**
     * Единица вместе с данными, нужными для ее выполнения.
     * Цена считается по выбранным пользователем параметрам, провайдер получает их вместе со значениями по умолчанию.
     */
    public record UnitPlan(Generation unit, ResolvedModel model, List<String> inputImageUrls,
                           Map<String, Object> selectedOptions, Map<String, Object> providerOptions) {
    }

    private record PreparedBatch(String correlationId, CreditSource source, PricingSettings settings, List<UnitPlan> plans) {
    }
}
