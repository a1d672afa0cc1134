package ru.oparin.omnihub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import ru.oparin.omnihub.config.properties.GenerationProperties;
import ru.oparin.omnihub.exception.InsufficientCreditsException;
import ru.oparin.omnihub.mapper.JsonColumnMapper;
import ru.oparin.omnihub.model.dto.catalog.ResolvedModel;
import ru.oparin.omnihub.model.dto.chat.ChatMessageDTO;
import ru.oparin.omnihub.model.dto.chat.ChatRq;
import ru.oparin.omnihub.model.dto.chat.ChatStreamEvent;
import ru.oparin.omnihub.model.dto.credit.CreditSource;
import ru.oparin.omnihub.model.dto.pricing.PricingSettings;
import ru.oparin.omnihub.model.dto.provider.ChatChunk;
import ru.oparin.omnihub.model.entity.AiModel;
import ru.oparin.omnihub.model.entity.CreditReservation;
import ru.oparin.omnihub.model.entity.Generation;
import ru.oparin.omnihub.model.enums.AdapterKind;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.model.enums.GenerationType;
import ru.oparin.omnihub.repository.GenerationRepository;
import ru.oparin.omnihub.service.provider.StreamingChatAdapter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ChatGenerationService")
class ChatGenerationServiceTest {

    private static final Long USER_ID = 10L;
    private static final Long CHAT_ID = 5L;
    private static final CreditSource SOURCE = CreditSource.personal(USER_ID, 100L);

    @Mock
    private GenerationRepository generationRepository;

    @Mock
    private GenerationUnitService unitService;

    @Mock
    private CreditLedgerService creditLedgerService;

    @Mock
    private ModelCatalogService modelCatalogService;

    @Mock
    private PricingSettingsService pricingSettingsService;

    @Mock
    private StreamingChatAdapter chatAdapter;

    private ChatGenerationService chatService;

    @BeforeEach
    void setUp() {
        chatService = new ChatGenerationService(generationRepository, unitService, creditLedgerService,
                modelCatalogService, pricingSettingsService, new PricingCalculator(), new GenerationProperties(),
                new JsonColumnMapper(new ObjectMapper()));

        when(modelCatalogService.getModel("gpt-4o-mini")).thenReturn(Mono.just(chatModel()));
        when(creditLedgerService.resolveSource(USER_ID, null)).thenReturn(Mono.just(SOURCE));
        when(pricingSettingsService.getSettings()).thenReturn(Mono.just(PricingSettings.builder().build()));
        when(generationRepository.save(any(Generation.class)))
                .thenAnswer(inv -> Mono.just(inv.<Generation>getArgument(0).toBuilder().id(CHAT_ID).build()));
        when(unitService.advance(eq(CHAT_ID), any(), eq(GenerationStatus.RESERVING))).thenReturn(Mono.just(true));
    }

    @Test
    @DisplayName("Полный ответ оплачивается по токенам из итогового фрагмента")
    void completedStreamSettlesOnUsage() {
        stubReservation();
        when(chatAdapter.getProvider()).thenReturn(GenerationProvider.OPENROUTER);
        when(chatAdapter.open(any())).thenReturn(Flux.just(
                ChatChunk.delta("При"), ChatChunk.delta("вет"), ChatChunk.usage(10, 2)));
        // (10 * 0.15 + 2 * 0.6) / 1000
        BigDecimal expected = new BigDecimal("0.00270000");
        when(unitService.complete(eq(CHAT_ID), any(), eq(expected)))
                .thenReturn(Mono.just(completedUnit(expected)));
        when(creditLedgerService.getBalance(SOURCE)).thenReturn(Mono.just(new BigDecimal("9.9973")));

        StepVerifier.create(chatService.streamChat(request(), USER_ID))
                .assertNext(event -> assertThat(event.getType()).isEqualTo(ChatStreamEvent.START))
                .assertNext(event -> assertThat(event.getContent()).isEqualTo("При"))
                .assertNext(event -> assertThat(event.getContent()).isEqualTo("вет"))
                .assertNext(event -> {
                    assertThat(event.getType()).isEqualTo(ChatStreamEvent.DONE);
                    assertThat(event.getCredits()).isEqualByComparingTo(expected);
                    assertThat(event.getBalance()).isEqualByComparingTo("9.9973");
                    assertThat(event.getStopped()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Остановка после первых фрагментов сохраняет ответ и закрывает поток провайдера")
    void stopAfterPartialOutputCompletes() {
        stubReservation();
        Sinks.Many<ChatChunk> upstream = Sinks.many().unicast().onBackpressureBuffer();
        when(chatAdapter.getProvider()).thenReturn(GenerationProvider.OPENROUTER);
        when(chatAdapter.open(any())).thenReturn(upstream.asFlux());
        when(unitService.complete(eq(CHAT_ID), any(), any()))
                .thenAnswer(inv -> Mono.just(completedUnit(inv.getArgument(2))));
        when(creditLedgerService.getBalance(SOURCE)).thenReturn(Mono.just(BigDecimal.TEN));

        StepVerifier.create(chatService.streamChat(request(), USER_ID))
                .assertNext(event -> assertThat(event.getType()).isEqualTo(ChatStreamEvent.START))
                .then(() -> upstream.tryEmitNext(ChatChunk.delta("Частичный ответ")))
                .assertNext(event -> assertThat(event.getType()).isEqualTo(ChatStreamEvent.CONTENT))
                .then(() -> assertThat(chatService.stopChat(CHAT_ID, USER_ID).block()).isTrue())
                .assertNext(event -> {
                    assertThat(event.getType()).isEqualTo(ChatStreamEvent.DONE);
                    assertThat(event.getStopped()).isTrue();
                    assertThat(event.getCredits()).isPositive();
                })
                .verifyComplete();

        assertThat(upstream.currentSubscriberCount()).isZero();
        verify(unitService, never()).fail(any(), any(), any());
    }

    @Test
    @DisplayName("Остановка до первого фрагмента завершает чат отменой с возвратом")
    void stopBeforeOutputCancels() {
        stubReservation();
        when(chatAdapter.open(any())).thenReturn(Flux.never());
        when(unitService.fail(eq(CHAT_ID), eq(GenerationErrorType.CANCELLED), anyString()))
                .thenReturn(Mono.just(Generation.builder().id(CHAT_ID).status(GenerationStatus.FAILED).build()));

        StepVerifier.create(chatService.streamChat(request(), USER_ID))
                .assertNext(event -> assertThat(event.getType()).isEqualTo(ChatStreamEvent.START))
                .then(() -> chatService.stopChat(CHAT_ID, USER_ID).block())
                .assertNext(event -> {
                    assertThat(event.getType()).isEqualTo(ChatStreamEvent.ERROR);
                    assertThat(event.getError()).isEqualTo(GenerationErrorType.CANCELLED.getUserMessage());
                })
                .verifyComplete();

        verify(unitService, never()).complete(any(), any(), any());
    }

    @Test
    @DisplayName("Без кредитов поток состоит из одного события error")
    void insufficientCreditsProducesSingleError() {
        when(creditLedgerService.reserve(eq(SOURCE), any(), eq(CHAT_ID)))
                .thenReturn(Mono.error(new InsufficientCreditsException(CreditSourceType.PERSONAL, BigDecimal.ONE)));
        when(unitService.fail(eq(CHAT_ID), eq(GenerationErrorType.INSUFFICIENT_CREDITS), any()))
                .thenReturn(Mono.just(Generation.builder().id(CHAT_ID).status(GenerationStatus.FAILED).build()));

        StepVerifier.create(chatService.streamChat(request(), USER_ID))
                .assertNext(event -> {
                    assertThat(event.getType()).isEqualTo(ChatStreamEvent.ERROR);
                    assertThat(event.getError()).isEqualTo(GenerationErrorType.INSUFFICIENT_CREDITS.getUserMessage());
                })
                .verifyComplete();

        verify(chatAdapter, never()).open(any());
    }

    @Test
    @DisplayName("Резерв покрывает фактическую стоимость, когда входных токенов больше, чем символов / 4")
    void reservationCoversReportedUsage() {
        stubReservation();
        when(chatAdapter.getProvider()).thenReturn(GenerationProvider.OPENROUTER);
        when(chatAdapter.open(any())).thenReturn(Flux.just(ChatChunk.delta("Хорошо"), ChatChunk.usage(12, 16)));
        when(unitService.complete(eq(CHAT_ID), any(), any()))
                .thenAnswer(inv -> Mono.just(completedUnit(inv.getArgument(2))));
        when(creditLedgerService.getBalance(SOURCE)).thenReturn(Mono.just(BigDecimal.TEN));

        ChatRq request = ChatRq.builder()
                .model("gpt-4o-mini")
                .maxTokens(16)
                .messages(List.of(ChatMessageDTO.builder().role("user").content("Привет, как дела?").build()))
                .build();

        StepVerifier.create(chatService.streamChat(request, USER_ID))
                .expectNextCount(2)
                .assertNext(event -> assertThat(event.getType()).isEqualTo(ChatStreamEvent.DONE))
                .verifyComplete();

        ArgumentCaptor<BigDecimal> reserved = ArgumentCaptor.forClass(BigDecimal.class);
        ArgumentCaptor<BigDecimal> charged = ArgumentCaptor.forClass(BigDecimal.class);
        verify(creditLedgerService).reserve(eq(SOURCE), reserved.capture(), eq(CHAT_ID));
        verify(unitService).complete(eq(CHAT_ID), any(), charged.capture());
        // (12 * 0.15 + 16 * 0.6) / 1000
        assertThat(charged.getValue()).isEqualByComparingTo("0.0114");
        assertThat(reserved.getValue()).isGreaterThanOrEqualTo(charged.getValue());
    }

    @Test
    @DisplayName("Если чат уже вышел из PENDING, кредиты не резервируются и поток завершается ошибкой")
    void lostPendingTransitionSkipsReservation() {
        when(unitService.advance(eq(CHAT_ID), any(), eq(GenerationStatus.RESERVING))).thenReturn(Mono.just(false));
        when(unitService.fail(eq(CHAT_ID), eq(GenerationErrorType.CANCELLED), anyString()))
                .thenReturn(Mono.just(Generation.builder()
                        .id(CHAT_ID)
                        .status(GenerationStatus.FAILED)
                        .errorType(GenerationErrorType.CANCELLED)
                        .build()));

        StepVerifier.create(chatService.streamChat(request(), USER_ID))
                .assertNext(event -> {
                    assertThat(event.getType()).isEqualTo(ChatStreamEvent.ERROR);
                    assertThat(event.getError()).isEqualTo(GenerationErrorType.CANCELLED.getUserMessage());
                })
                .verifyComplete();

        verify(creditLedgerService, never()).reserve(any(), any(), any());
        verify(chatAdapter, never()).open(any());
    }

    private void stubReservation() {
        when(creditLedgerService.reserve(eq(SOURCE), any(), eq(CHAT_ID)))
                .thenAnswer(inv -> Mono.just(CreditReservation.builder()
                        .id(50L)
                        .generationId(CHAT_ID)
                        .sourceType(CreditSourceType.PERSONAL)
                        .userId(USER_ID)
                        .amount(inv.getArgument(1))
                        .build()));
        when(unitService.markDispatched(any(), any())).thenReturn(Mono.just(true));
    }

    private ResolvedModel chatModel() {
        return ResolvedModel.builder()
                .model(AiModel.builder()
                        .id("gpt-4o-mini")
                        .type(GenerationType.CHAT)
                        .provider(GenerationProvider.OPENROUTER)
                        .endpoint("openai/gpt-4o-mini")
                        .inputCost(new BigDecimal("0.15"))
                        .outputCost(new BigDecimal("0.6"))
                        .build())
                .options(Map.of())
                .kind(AdapterKind.STREAMING)
                .adapter(chatAdapter)
                .build();
    }

    private static ChatRq request() {
        return ChatRq.builder()
                .model("gpt-4o-mini")
                .messages(List.of(ChatMessageDTO.builder().role("user").content("Привет!").build()))
                .build();
    }

    private static Generation completedUnit(BigDecimal credits) {
        return Generation.builder()
                .id(CHAT_ID)
                .userId(USER_ID)
                .type(GenerationType.CHAT)
                .status(GenerationStatus.COMPLETED)
                .credits(credits)
                .build();
    }
}
