package ru.oparin.omnihub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.omnihub.mapper.JsonColumnMapper;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.entity.CreditReservation;
import ru.oparin.omnihub.model.entity.Generation;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationProvider;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.model.enums.GenerationType;
import ru.oparin.omnihub.model.enums.ReservationStatus;
import ru.oparin.omnihub.repository.CreditReservationRepository;
import ru.oparin.omnihub.repository.GenerationRepository;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GenerationUnitService")
class GenerationUnitServiceTest {

    @Mock
    private GenerationRepository generationRepository;

    @Mock
    private CreditReservationRepository reservationRepository;

    @Mock
    private CreditLedgerService creditLedgerService;

    private GenerationUnitService unitService;

    @BeforeEach
    void setUp() {
        unitService = new GenerationUnitService(generationRepository, reservationRepository, creditLedgerService,
                new JsonColumnMapper(new ObjectMapper()));
    }

    @Test
    @DisplayName("Успешное завершение списывает фактическую стоимость и сохраняет результат")
    void completeSettlesReservation() {
        Generation unit = unit(GenerationStatus.COMPLETED, 5L);
        CreditReservation reservation = reservation(5L, new BigDecimal("0.4"));
        when(generationRepository.claimTerminal(eq(1L), anyCollection(), eq("COMPLETED"), any())).thenReturn(Mono.just(1));
        when(generationRepository.findById(1L)).thenReturn(Mono.just(unit));
        when(reservationRepository.findById(5L)).thenReturn(Mono.just(reservation));
        when(creditLedgerService.settle(5L, new BigDecimal("0.3")))
                .thenReturn(Mono.just(reservation.toBuilder()
                        .status(ReservationStatus.SETTLED)
                        .settledAmount(new BigDecimal("0.3"))
                        .build()));
        when(generationRepository.save(any(Generation.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        GenerationResult result = GenerationResult.builder()
                .provider(GenerationProvider.FAL_AI)
                .urls(List.of("https://cdn.example/1.png"))
                .seed(7L)
                .build();

        StepVerifier.create(unitService.complete(1L, result, new BigDecimal("0.3")))
                .assertNext(saved -> {
                    assertThat(saved.getCredits()).isEqualByComparingTo("0.3");
                    assertThat(saved.getResultJson()).contains("https://cdn.example/1.png").contains("\"seed\":7");
                    assertThat(saved.getProvider()).isEqualTo(GenerationProvider.FAL_AI);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Завершение уже терминальной единицы ничего не списывает")
    void completeOnTerminalUnitIsNoOp() {
        Generation failed = unit(GenerationStatus.FAILED, 5L);
        when(generationRepository.claimTerminal(eq(1L), anyCollection(), eq("COMPLETED"), any())).thenReturn(Mono.just(0));
        when(generationRepository.findById(1L)).thenReturn(Mono.just(failed));

        StepVerifier.create(unitService.complete(1L, GenerationResult.builder().build(), BigDecimal.ONE))
                .assertNext(unit -> assertThat(unit.getStatus()).isEqualTo(GenerationStatus.FAILED))
                .verifyComplete();

        verify(creditLedgerService, never()).settle(any(), any());
        verify(generationRepository, never()).save(any(Generation.class));
    }

    @Test
    @DisplayName("Ошибка возвращает резерв и сохраняет только категорию ошибки")
    void failRefundsReservation() {
        Generation unit = unit(GenerationStatus.FAILED, 5L);
        CreditReservation reservation = reservation(5L, new BigDecimal("0.4"));
        when(generationRepository.claimTerminal(eq(1L), anyCollection(), eq("FAILED"), any())).thenReturn(Mono.just(1));
        when(generationRepository.findById(1L)).thenReturn(Mono.just(unit));
        when(reservationRepository.findById(5L)).thenReturn(Mono.just(reservation));
        when(creditLedgerService.refund(5L)).thenReturn(Mono.just(reservation.toBuilder().status(ReservationStatus.REFUNDED).build()));
        when(generationRepository.save(any(Generation.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(unitService.fail(1L, GenerationErrorType.TIMEOUT, "job-1 не завершилась за 600 с"))
                .assertNext(saved -> {
                    assertThat(saved.getErrorType()).isEqualTo(GenerationErrorType.TIMEOUT);
                    assertThat(saved.getErrorMessage()).isEqualTo(GenerationErrorType.TIMEOUT.getUserMessage());
                })
                .verifyComplete();

        verify(creditLedgerService).refund(5L);
    }

    @Test
    @DisplayName("Резерв без ссылки в единице находится по идентификатору генерации")
    void failFindsReservationByGenerationId() {
        Generation unit = unit(GenerationStatus.FAILED, null);
        CreditReservation reservation = reservation(9L, new BigDecimal("0.1"));
        when(generationRepository.claimTerminal(eq(1L), anyCollection(), eq("FAILED"), any())).thenReturn(Mono.just(1));
        when(generationRepository.findById(1L)).thenReturn(Mono.just(unit));
        when(reservationRepository.findByGenerationId(1L)).thenReturn(Mono.just(reservation));
        when(creditLedgerService.refund(9L)).thenReturn(Mono.just(reservation));
        when(generationRepository.save(any(Generation.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(unitService.fail(1L, GenerationErrorType.PROVIDER_UNAVAILABLE, "брошена"))
                .expectNextCount(1)
                .verifyComplete();

        verify(creditLedgerService).refund(9L);
    }

    private static Generation unit(GenerationStatus status, Long reservationId) {
        return Generation.builder()
                .id(1L)
                .correlationId("c-1")
                .userId(10L)
                .modelId("flux-schnell")
                .type(GenerationType.IMAGE)
                .status(status)
                .reservationId(reservationId)
                .build();
    }

    private static CreditReservation reservation(Long id, BigDecimal amount) {
        return CreditReservation.builder()
                .id(id)
                .generationId(1L)
                .sourceType(CreditSourceType.PERSONAL)
                .userId(10L)
                .amount(amount)
                .build();
    }
}
