package ru.oparin.omnihub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.omnihub.exception.InsufficientCreditsException;
import ru.oparin.omnihub.exception.NotFoundException;
import ru.oparin.omnihub.model.dto.credit.CreditSource;
import ru.oparin.omnihub.model.entity.CreditReservation;
import ru.oparin.omnihub.model.entity.LedgerEntry;
import ru.oparin.omnihub.model.entity.Workspace;
import ru.oparin.omnihub.model.enums.CreditMode;
import ru.oparin.omnihub.model.enums.GenerationErrorType;
import ru.oparin.omnihub.model.enums.LedgerOperation;
import ru.oparin.omnihub.model.enums.ReservationStatus;
import ru.oparin.omnihub.repository.CreditReservationRepository;
import ru.oparin.omnihub.repository.LedgerEntryRepository;
import ru.oparin.omnihub.repository.UserRepository;
import ru.oparin.omnihub.repository.WorkspaceMemberRepository;
import ru.oparin.omnihub.repository.WorkspaceRepository;

import java.math.BigDecimal;

/**
 * Журнал кредитов: единственное место, где меняются балансы источников.
 * <p>
 * Резерв списывает сумму условным UPDATE (баланс не меньше суммы), поэтому два конкурентных
 * резерва одного источника не могут вместе уйти в минус. Резервирование закрывается ровно
 * одним settle или refund: закрытие выполняется условным переходом статуса из RESERVED.
 * Каждое изменение баланса сопровождается записью журнала в той же транзакции.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditLedgerService {

    private final UserRepository userRepository;
    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository workspaceMemberRepository;
    private final CreditReservationRepository reservationRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final WorkspaceService workspaceService;

    /**
     * Определить источник кредитов для пользователя в workspace.
     * Дефолтный workspace (или его отсутствие) означает личный баланс, иначе источник
     * задает режим workspace: общий пул или аллокация участника.
     *
     * @param userId      пользователь
     * @param workspaceId workspace или null
     */
    public Mono<CreditSource> resolveSource(Long userId, Long workspaceId) {
        return workspaceService.findAccessibleWorkspace(userId, workspaceId)
                .map(workspace -> toSource(workspace, userId))
                .defaultIfEmpty(CreditSource.personal(userId, null));
    }

    private CreditSource toSource(Workspace workspace, Long userId) {
        if (workspace.isDefaultWorkspace()) {
            return CreditSource.personal(userId, workspace.getId());
        }
        return workspace.getCreditMode() == CreditMode.INDIVIDUAL
                ? CreditSource.allocated(workspace.getId(), userId)
                : CreditSource.workspace(workspace.getId(), userId);
    }

    /**
     * Зарезервировать кредиты под единицу генерации.
     *
     * @param source       источник
     * @param amount       сумма резерва (неотрицательная)
     * @param generationId единица генерации
     * @return резервирование или {@link InsufficientCreditsException}
     */
    @Transactional
    public Mono<CreditReservation> reserve(CreditSource source, BigDecimal amount, Long generationId) {
        if (amount == null || amount.signum() < 0) {
            return Mono.error(new IllegalArgumentException("Сумма резерва должна быть неотрицательной: " + amount));
        }
        log.info("Резерв {} кредитов из {} для генерации {}", amount.toPlainString(), source, generationId);

        return debitIfSufficient(source, amount)
                .flatMap(updated -> {
                    if (updated == 0) {
                        log.info("Недостаточно кредитов в {} для генерации {}: требуется {}",
                                source, generationId, amount.toPlainString());
                        return Mono.error(new InsufficientCreditsException(source.getType(), amount));
                    }
                    CreditReservation reservation = CreditReservation.builder()
                            .generationId(generationId)
                            .sourceType(source.getType())
                            .userId(source.getUserId())
                            .workspaceId(source.getWorkspaceId())
                            .amount(amount)
                            .status(ReservationStatus.RESERVED)
                            .build();
                    return reservationRepository.save(reservation);
                })
                .flatMap(reservation -> appendEntry(reservation, source, LedgerOperation.RESERVE, amount, amount.negate())
                        .thenReturn(reservation));
    }

    /**
     * Закрыть резервирование фактическим списанием. Разница между резервом и фактом возвращается источнику.
     * Факт больше резерва - нарушение инварианта: оно логируется, списание ограничивается резервом.
     * Повторное закрытие ничего не меняет.
     *
     * @param reservationId резервирование
     * @param actualAmount  фактическая стоимость
     * @return резервирование после закрытия
     */
    @Transactional
    public Mono<CreditReservation> settle(Long reservationId, BigDecimal actualAmount) {
        return findReservation(reservationId)
                .flatMap(reservation -> {
                    BigDecimal settled = capToReservation(reservation, actualAmount);
                    BigDecimal returned = reservation.getAmount().subtract(settled);
                    return close(reservation, ReservationStatus.SETTLED, settled)
                            .flatMap(closed -> {
                                if (!closed) {
                                    return Mono.just(reservation);
                                }
                                CreditSource source = sourceOf(reservation);
                                Mono<Integer> giveBack = returned.signum() > 0
                                        ? credit(source, returned)
                                        : Mono.just(0);
                                log.info("Списано {} кредитов по резерву {} (генерация {}), возвращено {}",
                                        settled.toPlainString(), reservationId, reservation.getGenerationId(),
                                        returned.toPlainString());
                                return giveBack
                                        .then(appendEntry(reservation, source, LedgerOperation.SETTLE, settled, returned))
                                        .then(reservationRepository.findById(reservationId));
                            });
                });
    }

    /**
     * Полностью вернуть резерв источнику. Повторное закрытие ничего не меняет.
     *
     * @param reservationId резервирование
     * @return резервирование после закрытия
     */
    @Transactional
    public Mono<CreditReservation> refund(Long reservationId) {
        return findReservation(reservationId)
                .flatMap(reservation -> close(reservation, ReservationStatus.REFUNDED, BigDecimal.ZERO)
                        .flatMap(closed -> {
                            if (!closed) {
                                return Mono.just(reservation);
                            }
                            CreditSource source = sourceOf(reservation);
                            log.info("Возврат {} кредитов по резерву {} (генерация {}) в {}",
                                    reservation.getAmount().toPlainString(), reservationId,
                                    reservation.getGenerationId(), source);
                            return credit(source, reservation.getAmount())
                                    .then(appendEntry(reservation, source, LedgerOperation.REFUND,
                                            reservation.getAmount(), reservation.getAmount()))
                                    .then(reservationRepository.findById(reservationId));
                        }));
    }

    /**
     * Текущий (кешированный) баланс источника.
     */
    public Mono<BigDecimal> getBalance(CreditSource source) {
        Mono<BigDecimal> balance = switch (source.getType()) {
            case PERSONAL -> userRepository.findCreditsById(source.getUserId());
            case WORKSPACE -> workspaceRepository.findCreditsById(source.getWorkspaceId());
            case ALLOCATED -> workspaceMemberRepository.findAllocatedCredits(source.getWorkspaceId(), source.getUserId());
        };
        return balance.defaultIfEmpty(BigDecimal.ZERO);
    }

    /**
     * Записи журнала по единице генерации в порядке добавления.
     */
    public Flux<LedgerEntry> getEntries(Long generationId) {
        return ledgerEntryRepository.findByGenerationIdOrderByIdAsc(generationId);
    }

    /**
     * Суммарное изменение баланса источника по журналу.
     * Для сверки: равно изменению кешированного баланса за счет операций журнала.
     */
    public Mono<BigDecimal> replayBalanceDelta(CreditSource source) {
        return switch (source.getType()) {
            case PERSONAL -> ledgerEntryRepository.sumPersonalDelta(source.getUserId());
            case WORKSPACE -> ledgerEntryRepository.sumWorkspaceDelta(source.getWorkspaceId());
            case ALLOCATED -> ledgerEntryRepository.sumAllocatedDelta(source.getWorkspaceId(), source.getUserId());
        };
    }

    private Mono<CreditReservation> findReservation(Long reservationId) {
        return reservationRepository.findById(reservationId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Резервирование не найдено: " + reservationId)));
    }

    private BigDecimal capToReservation(CreditReservation reservation, BigDecimal actualAmount) {
        if (actualAmount == null || actualAmount.signum() < 0) {
            log.error("{}: некорректная фактическая сумма {} по резерву {}, списание не выполняется",
                    GenerationErrorType.INTERNAL_INVARIANT_VIOLATION, actualAmount, reservation.getId());
            return BigDecimal.ZERO;
        }
        if (actualAmount.compareTo(reservation.getAmount()) > 0) {
            log.error("{}: фактическая стоимость {} превышает резерв {} (резерв {}, генерация {}), списание ограничено резервом",
                    GenerationErrorType.INTERNAL_INVARIANT_VIOLATION, actualAmount.toPlainString(),
                    reservation.getAmount().toPlainString(), reservation.getId(), reservation.getGenerationId());
            return reservation.getAmount();
        }
        return actualAmount;
    }

    private Mono<Boolean> close(CreditReservation reservation, ReservationStatus status, BigDecimal settledAmount) {
        return reservationRepository.closeIfReserved(reservation.getId(), status.name(), settledAmount)
                .map(updated -> {
                    if (updated == 0) {
                        log.warn("Резерв {} уже закрыт, повторный {} пропущен", reservation.getId(), status);
                        return false;
                    }
                    return true;
                });
    }

    private Mono<Integer> debitIfSufficient(CreditSource source, BigDecimal amount) {
        return switch (source.getType()) {
            case PERSONAL -> userRepository.debitIfSufficient(source.getUserId(), amount);
            case WORKSPACE -> workspaceRepository.debitIfSufficient(source.getWorkspaceId(), amount);
            case ALLOCATED -> workspaceMemberRepository.debitIfSufficient(source.getWorkspaceId(), source.getUserId(), amount);
        };
    }

    private Mono<Integer> credit(CreditSource source, BigDecimal amount) {
        return switch (source.getType()) {
            case PERSONAL -> userRepository.credit(source.getUserId(), amount);
            case WORKSPACE -> workspaceRepository.credit(source.getWorkspaceId(), amount);
            case ALLOCATED -> workspaceMemberRepository.credit(source.getWorkspaceId(), source.getUserId(), amount);
        };
    }

    private Mono<LedgerEntry> appendEntry(CreditReservation reservation, CreditSource source,
                                          LedgerOperation operation, BigDecimal amount, BigDecimal balanceDelta) {
        return getBalance(source)
                .flatMap(balanceAfter -> ledgerEntryRepository.save(LedgerEntry.builder()
                        .generationId(reservation.getGenerationId())
                        .reservationId(reservation.getId())
                        .sourceType(source.getType())
                        .userId(source.getUserId())
                        .workspaceId(source.getWorkspaceId())
                        .operation(operation)
                        .amount(amount)
                        .balanceDelta(balanceDelta)
                        .balanceAfter(balanceAfter)
                        .build()));
    }

    private static CreditSource sourceOf(CreditReservation reservation) {
        return new CreditSource(reservation.getSourceType(), reservation.getUserId(), reservation.getWorkspaceId());
    }
}
