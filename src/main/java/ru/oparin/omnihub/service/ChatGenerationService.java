package ru.oparin.omnihub.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import ru.oparin.omnihub.config.properties.GenerationProperties;
import ru.oparin.omnihub.exception.GenerationException;
import ru.oparin.omnihub.exception.InvalidRequestException;
import ru.oparin.omnihub.exception.NotFoundException;
import ru.oparin.omnihub.mapper.JsonColumnMapper;
import ru.oparin.omnihub.model.dto.catalog.ResolvedModel;
import ru.oparin.omnihub.model.dto.chat.ChatMessageDTO;
import ru.oparin.omnihub.model.dto.chat.ChatRq;
import ru.oparin.omnihub.model.dto.chat.ChatStreamEvent;
import ru.oparin.omnihub.model.dto.credit.CreditSource;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;
import ru.oparin.omnihub.model.dto.provider.ChatChunk;
import ru.oparin.omnihub.model.dto.provider.ChatProviderRequest;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.entity.CreditReservation;
import ru.oparin.omnihub.model.entity.Generation;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.model.enums.GenerationType;
import ru.oparin.omnihub.repository.GenerationRepository;
import ru.oparin.omnihub.service.provider.StreamingChatAdapter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Потоковые ответы чат-моделей.
 * <p>
 * Перед открытием потока резервируется верхняя оценка: входные токены по длине сообщений
 * и максимальное количество выходных токенов. По завершении списывается стоимость фактически
 * использованных токенов, остаток резерва возвращается.
 * <p>
 * Остановка пользователем закрывает поток провайдера. Если ответ уже начался, единица завершается
 * успешно с оплатой полученной части, иначе - ошибкой CANCELLED с полным возвратом.
 */
@Slf4j
@Service
public class ChatGenerationService {

    private final GenerationRepository generationRepository;
    private final GenerationUnitService unitService;
    private final CreditLedgerService creditLedgerService;
    private final ModelCatalogService modelCatalogService;
    private final PricingSettingsService pricingSettingsService;
    private final PricingCalculator pricingCalculator;
    private final GenerationProperties generationProperties;
    private final JsonColumnMapper jsonColumnMapper;

    private final Map<Long, ActiveStream> activeStreams = new ConcurrentHashMap<>();

    public ChatGenerationService(GenerationRepository generationRepository,
                                 GenerationUnitService unitService,
                                 CreditLedgerService creditLedgerService,
                                 ModelCatalogService modelCatalogService,
                                 PricingSettingsService pricingSettingsService,
                                 PricingCalculator pricingCalculator,
                                 GenerationProperties generationProperties,
                                 JsonColumnMapper jsonColumnMapper) {
        this.generationRepository = generationRepository;
        this.unitService = unitService;
        this.creditLedgerService = creditLedgerService;
        this.modelCatalogService = modelCatalogService;
        this.pricingSettingsService = pricingSettingsService;
        this.pricingCalculator = pricingCalculator;
        this.generationProperties = generationProperties;
        this.jsonColumnMapper = jsonColumnMapper;
    }

    /**
     * Открыть поток ответа чат-модели.
     * Поток начинается событием start и заканчивается событием done или error.
     * Если кредитов не хватило на резерв, поток состоит из одного события error.
     *
     * @param request запрос
     * @param userId  пользователь
     * @return события потока
     */
    public Flux<ChatStreamEvent> streamChat(ChatRq request, Long userId) {
        return Mono.zip(modelCatalogService.getModel(request.getModel()),
                        creditLedgerService.resolveSource(userId, request.getWorkspaceId()),
                        pricingSettingsService.getSettings())
                .flatMap(tuple -> {
                    ResolvedModel model = tuple.getT1();
                    if (model.getModel().getType() != GenerationType.CHAT) {
                        return Mono.error(new InvalidRequestException("Модель " + model.getId() + " не является чат-моделью"));
                    }
                    return createUnit(request, model, userId, tuple.getT2())
                            .map(unit -> new ChatSession(unit, model, tuple.getT2(), tuple.getT3(), request,
                                    estimateInputTokens(request.getMessages()), maxOutputTokens(request)));
                })
                .flatMapMany(session -> Mono.defer(() -> reserve(session))
                        .flatMapMany(this::stream)
                        .onErrorResume(error -> failSession(session, error).flux()));
    }

    /**
     * Остановить поток ответа.
     *
     * @param generationId единица чата
     * @param userId       пользователь
     * @return true если поток был активен и остановлен этим вызовом
     */
    public Mono<Boolean> stopChat(Long generationId, Long userId) {
        ActiveStream active = activeStreams.get(generationId);
        if (active != null && active.userId().equals(userId)) {
            boolean first = active.stopped().compareAndSet(false, true);
            if (first) {
                log.info("Пользователь {} остановил ответ чата {}", userId, generationId);
                active.stopSignal().tryEmitValue(true);
            }
            return Mono.just(first);
        }
        return generationRepository.findById(generationId)
                .filter(unit -> userId.equals(unit.getUserId()) && unit.getType() == GenerationType.CHAT)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Чат не найден: " + generationId)))
                .map(unit -> false);
    }

    private Mono<Generation> createUnit(ChatRq request, ResolvedModel model, Long userId, CreditSource source) {
        List<ChatMessageDTO> messages = request.getMessages();
        Generation unit = Generation.builder()
                .correlationId(UUID.randomUUID().toString())
                .userId(userId)
                .workspaceId(source.getWorkspaceId())
                .modelId(model.getId())
                .type(GenerationType.CHAT)
                .prompt(messages.get(messages.size() - 1).getContent())
                .inputJson(jsonColumnMapper.write(messages))
                .optionsJson(jsonColumnMapper.write(request.getOptions()))
                .quantity(1)
                .status(GenerationStatus.PENDING)
                .provider(model.getModel().getProvider())
                .build();
        return generationRepository.save(unit);
    }

    private Mono<ChatSession> reserve(ChatSession session) {
        Generation unit = session.unit();
        BigDecimal estimated = pricingCalculator.estimateChatCredits(session.model().getModel(),
                session.model().getOptions(), session.options(), session.inputTokens(), session.maxOutputTokens(),
                session.settings());
        return unitService.advance(unit.getId(), List.of(GenerationStatus.PENDING), GenerationStatus.RESERVING)
                .flatMap(advanced -> advanced
                        ? creditLedgerService.reserve(session.source(), estimated, unit.getId())
                        : Mono.<CreditReservation>error(new GenerationException(GenerationErrorType.CANCELLED,
                                "чат " + unit.getId() + " уже не ожидает резервирования")))
                .flatMap(reservation -> unitService.markDispatched(unit, reservation)
                        .doOnNext(dispatched -> unit.setEstimatedCredits(reservation.getAmount())))
                .thenReturn(session);
    }

    private Flux<ChatStreamEvent> stream(ChatSession session) {
        Long id = session.unit().getId();
        StreamingChatAdapter adapter = session.model().adapter(StreamingChatAdapter.class);
        ActiveStream active = new ActiveStream(session.unit().getUserId(), Sinks.one(), new AtomicBoolean(false));
        activeStreams.put(id, active);

        StringBuilder text = new StringBuilder();
        AtomicReference<ChatChunk> usage = new AtomicReference<>();
        AtomicBoolean finished = new AtomicBoolean(false);

        ChatProviderRequest request = ChatProviderRequest.builder()
                .generationId(id)
                .endpoint(session.model().getModel().getEndpoint())
                .messages(session.request().getMessages())
                .options(session.options())
                .maxTokens(session.maxOutputTokens())
                .build();

        Flux<ChatStreamEvent> content = adapter.open(request)
                .takeUntilOther(active.stopSignal().asMono())
                .doOnNext(chunk -> {
                    if (chunk.isUsage()) {
                        usage.set(chunk);
                    }
                    if (chunk.hasDelta()) {
                        text.append(chunk.getDelta());
                    }
                })
                .filter(ChatChunk::hasDelta)
                .map(chunk -> ChatStreamEvent.content(id, chunk.getDelta()));

        return Flux.concat(
                        Mono.just(ChatStreamEvent.start(id)),
                        content,
                        Mono.defer(() -> finished.compareAndSet(false, true)
                                ? finish(session, text.toString(), usage.get(), active.stopped().get())
                                : Mono.empty()))
                .onErrorResume(error -> finished.compareAndSet(false, true)
                        ? failSession(session, error)
                        : Mono.empty())
                .doOnCancel(() -> {
                    if (finished.compareAndSet(false, true)) {
                        log.info("Клиент отключился от потока чата {}, фиксируем полученную часть", id);
                        finish(session, text.toString(), usage.get(), true)
                                .subscribe(
                                        event -> log.debug("Чат {} завершен после отключения клиента: {}", id, event.getType()),
                                        error -> log.error("Не удалось завершить чат {} после отключения клиента", id, error));
                    }
                })
                .doFinally(signal -> activeStreams.remove(id));
    }

    /**
     * Завершить единицу по итогам потока и сформировать финальное событие.
     */
    private Mono<ChatStreamEvent> finish(ChatSession session, String text, ChatChunk usage, boolean stopped) {
        Long id = session.unit().getId();
        if (text.isEmpty()) {
            GenerationErrorType errorType = stopped ? GenerationErrorType.CANCELLED : GenerationErrorType.PROVIDER_UNAVAILABLE;
            return unitService.fail(id, errorType, stopped ? "ответ остановлен до первого фрагмента" : "провайдер вернул пустой ответ")
                    .map(unit -> ChatStreamEvent.error(id, errorType.getUserMessage()));
        }

        int inputTokens = usage != null && usage.getInputTokens() != null ? usage.getInputTokens() : session.inputTokens();
        int outputTokens = usage != null && usage.getOutputTokens() != null
                ? usage.getOutputTokens()
                : Math.min(PricingCalculator.estimateTokens(text), session.maxOutputTokens());
        BigDecimal credits = pricingCalculator.chatCredits(session.model().getModel(), session.model().getOptions(),
                session.options(), inputTokens, outputTokens, session.settings());
        log.info("Ответ чата {} {}: входных токенов {}, выходных {}, стоимость {} кредитов",
                id, stopped ? "остановлен" : "получен", inputTokens, outputTokens, credits.toPlainString());

        GenerationResult result = GenerationResult.builder()
                .provider(session.model().getAdapter().getProvider())
                .text(text)
                .build();
        return unitService.complete(id, result, credits)
                .flatMap(unit -> creditLedgerService.getBalance(session.source())
                        .map(balance -> ChatStreamEvent.builder()
                                .type(ChatStreamEvent.DONE)
                                .generationId(id)
                                .credits(unit.getCredits())
                                .balance(balance)
                                .stopped(stopped)
                                .build()));
    }

    private Mono<ChatStreamEvent> failSession(ChatSession session, Throwable error) {
        Long id = session.unit().getId();
        GenerationErrorType errorType = error instanceof GenerationException generationException
                ? generationException.getErrorType()
                : GenerationErrorType.INTERNAL_INVARIANT_VIOLATION;
        if (errorType == GenerationErrorType.INTERNAL_INVARIANT_VIOLATION) {
            log.error("Непредвиденная ошибка чата {}", id, error);
        }
        return unitService.fail(id, errorType, error.getMessage())
                .map(unit -> {
                    GenerationErrorType stored = unit.getErrorType() != null ? unit.getErrorType() : errorType;
                    return ChatStreamEvent.error(id, stored.getUserMessage());
                });
    }

    /**
     * Верхняя граница входных токенов: байты UTF-8 каждого сообщения плюс служебные токены на сообщение.
     */
    private int estimateInputTokens(List<ChatMessageDTO> messages) {
        int overhead = generationProperties.getChatMessageOverheadTokens();
        return messages.stream()
                .mapToInt(message -> PricingCalculator.maxTokens(message.getContent()) + overhead)
                .sum();
    }

    private int maxOutputTokens(ChatRq request) {
        int limit = generationProperties.getChatMaxOutputTokens();
        if (request.getMaxTokens() != null && request.getMaxTokens() > 0) {
            return Math.min(request.getMaxTokens(), limit);
        }
        return limit;
    }

    private record ChatSession(Generation unit, ResolvedModel model, CreditSource source, PricingSettings settings,
                               ChatRq request, int inputTokens, int maxOutputTokens) {

        Map<String, Object> options() {
            return request.getOptions() != null ? request.getOptions() : Map.of();
        }
    }

    private record ActiveStream(Long userId, Sinks.One<Boolean> stopSignal, AtomicBoolean stopped) {
    }
}
