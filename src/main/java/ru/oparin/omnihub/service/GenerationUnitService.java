package ru.oparin.omnihub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.mapper.JsonColumnMapper;
import ru.oparin.omnihub.model.dto.provider.GenerationResult;
import ru.oparin.omnihub.model.dto.provider.JobHandle;
import ru.oparin.omnihub.model.dto.provider.JobStatus;
import ru.oparin.omnihub.model.entity.CreditReservation;
import ru.oparin.omnihub.model.entity.Generation;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.GenerationStatus;
import ru.oparin.omnihub.repository.CreditReservationRepository;
import ru.oparin.omnihub.repository.GenerationRepository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Переходы статусов единицы генерации.
 * <p>
 * Каждый переход - условный UPDATE по текущему статусу. Терминальный переход захватывается
 * одним вызовом, и только он закрывает резерв кредитов (settle или refund) в той же транзакции.
 * Проигравшие вызовы (поздний webhook, опрос после таймаута) ничего не меняют.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationUnitService {

    public static final String RESULT_URLS = "urls";
    public static final String RESULT_TEXT = "text";
    public static final String RESULT_SEED = "seed";

    private final GenerationRepository generationRepository;
    private final CreditReservationRepository reservationRepository;
    private final CreditLedgerService creditLedgerService;
    private final JsonColumnMapper jsonColumnMapper;

    /**
     * Перевести единицу в нетерминальный статус.
     *
     * @return true если переход выполнен этим вызовом
     */
    public Mono<Boolean> advance(Long id, List<GenerationStatus> expected, GenerationStatus next) {
        return generationRepository.transition(id, names(expected), next.name())
                .map(updated -> logTransition(id, updated, next));
    }

    /**
     * Зафиксировать резерв и перевести единицу в DISPATCHED.
     */
    public Mono<Boolean> markDispatched(Generation unit, CreditReservation reservation) {
        return generationRepository.markReserved(unit.getId(), List.of(GenerationStatus.RESERVING.name()),
                        GenerationStatus.DISPATCHED.name(), reservation.getAmount(),
                        reservation.getSourceType().name(), reservation.getId(), LocalDateTime.now())
                .map(updated -> logTransition(unit.getId(), updated, GenerationStatus.DISPATCHED));
    }

    /**
     * Зафиксировать идентификатор асинхронной задачи.
     */
    public Mono<Boolean> markSubmitted(Long id, JobHandle handle) {
        GenerationStatus next = handle.getQueuePosition() != null && handle.getQueuePosition() > 0
                ? GenerationStatus.QUEUED
                : GenerationStatus.RUNNING;
        return generationRepository.markSubmitted(id, List.of(GenerationStatus.DISPATCHED.name()), next.name(),
                        handle.getProvider().name(), handle.getJobId(), handle.getQueuePosition())
                .map(updated -> logTransition(id, updated, next));
    }

    /**
     * Обновить прогресс асинхронной задачи (очередь или выполнение).
     */
    public Mono<Boolean> updateProgress(Long id, JobStatus status) {
        GenerationStatus next = status.getState().toGenerationStatus();
        return generationRepository.updateProgress(id, GenerationStatus.dispatchedNames(), next.name(), status.getQueuePosition())
                .map(updated -> updated > 0);
    }

    /**
     * Завершить единицу успешно и списать фактическую стоимость.
     *
     * @param id            единица
     * @param result        результат провайдера
     * @param actualCredits фактическая стоимость в кредитах
     * @return единица после перехода; если она уже была терминальной, возвращается сохраненное состояние
     */
    @Transactional
    public Mono<Generation> complete(Long id, GenerationResult result, BigDecimal actualCredits) {
        return claim(id, GenerationStatus.COMPLETED)
                .flatMap(unit -> settle(unit, actualCredits)
                        .flatMap(reservation -> {
                            unit.setCredits(reservation.getSettledAmount());
                            unit.setResultJson(jsonColumnMapper.write(toPayload(result)));
                            if (result.getProvider() != null) {
                                unit.setProvider(result.getProvider());
                            }
                            unit.setQueuePosition(null);
                            return generationRepository.save(unit);
                        })
                        .doOnNext(saved -> log.info("Генерация {} (модель {}) завершена, списано {} кредитов",
                                saved.getId(), saved.getModelId(), saved.getCredits())))
                .switchIfEmpty(Mono.defer(() -> generationRepository.findById(id)));
    }

    /**
     * Завершить единицу ошибкой и вернуть резерв.
     *
     * @param id        единица
     * @param errorType категория ошибки (пользователь видит только ее описание)
     * @param reason    подробности для лога
     * @return единица после перехода; если она уже была терминальной, возвращается сохраненное состояние
     */
    @Transactional
    public Mono<Generation> fail(Long id, GenerationErrorType errorType, String reason) {
        return claim(id, GenerationStatus.FAILED)
                .flatMap(unit -> refund(unit)
                        .then(Mono.defer(() -> {
                            unit.setErrorType(errorType);
                            unit.setErrorMessage(errorType.getUserMessage());
                            unit.setQueuePosition(null);
                            return generationRepository.save(unit);
                        }))
                        .doOnNext(saved -> {
                            if (errorType == GenerationErrorType.INTERNAL_INVARIANT_VIOLATION
                                    || errorType == GenerationErrorType.CONFIGURATION_ERROR) {
                                log.error("Генерация {} (модель {}) завершилась ошибкой {}: {}",
                                        saved.getId(), saved.getModelId(), errorType, reason);
                            } else {
                                log.warn("Генерация {} (модель {}) завершилась ошибкой {}: {}",
                                        saved.getId(), saved.getModelId(), errorType, reason);
                            }
                        }))
                .switchIfEmpty(Mono.defer(() -> generationRepository.findById(id)));
    }

    private Mono<Generation> claim(Long id, GenerationStatus terminal) {
        return generationRepository.claimTerminal(id, GenerationStatus.activeNames(), terminal.name(), LocalDateTime.now())
                .flatMap(updated -> {
                    if (updated == 0) {
                        log.debug("Генерация {} уже в терминальном статусе, переход в {} пропущен", id, terminal);
                        return Mono.empty();
                    }
                    return generationRepository.findById(id);
                });
    }

    private Mono<CreditReservation> settle(Generation unit, BigDecimal actualCredits) {
        return findReservation(unit)
                .switchIfEmpty(Mono.defer(() -> {
                    log.error("{}: у завершенной генерации {} нет резерва кредитов",
                            GenerationErrorType.INTERNAL_INVARIANT_VIOLATION, unit.getId());
                    return Mono.just(CreditReservation.builder().settledAmount(BigDecimal.ZERO).build());
                }))
                .flatMap(reservation -> reservation.getId() == null
                        ? Mono.just(reservation)
                        : creditLedgerService.settle(reservation.getId(), actualCredits));
    }

    private Mono<CreditReservation> refund(Generation unit) {
        return findReservation(unit)
                .flatMap(reservation -> creditLedgerService.refund(reservation.getId()));
    }

    private Mono<CreditReservation> findReservation(Generation unit) {
        if (unit.getReservationId() != null) {
            return reservationRepository.findById(unit.getReservationId());
        }
        // резерв мог быть создан до сохранения ссылки на него в единице
        return reservationRepository.findByGenerationId(unit.getId());
    }

    private Map<String, Object> toPayload(GenerationResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(RESULT_URLS, result.getUrls());
        if (result.getText() != null) {
            payload.put(RESULT_TEXT, result.getText());
        }
        if (result.getSeed() != null) {
            payload.put(RESULT_SEED, result.getSeed());
        }
        return payload;
    }

    private boolean logTransition(Long id, Integer updated, GenerationStatus next) {
        if (updated == 0) {
            log.debug("Переход генерации {} в {} не выполнен: статус уже изменился", id, next);
            return false;
        }
        log.debug("Генерация {} переведена в {}", id, next);
        return true;
    }

    private static List<String> names(List<GenerationStatus> statuses) {
        return statuses.stream().map(Enum::name).toList();
    }
}
