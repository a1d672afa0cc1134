package ru.oparin.omnihub.service;

import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;
import ru.oparin.omnihub.exception.AuthException;
import ru.oparin.omnihub.exception.InsufficientCreditsException;
import ru.oparin.omnihub.model.dto.credit.CreditSource;
import ru.oparin.omnihub.model.entity.CreditReservation;
import ru.oparin.omnihub.model.entity.User;
import ru.oparin.omnihub.model.entity.Workspace;
import ru.oparin.omnihub.model.entity.WorkspaceMember;
import ru.oparin.omnihub.model.enums.CreditMode;
import ru.oparin.omnihub.model.enums.CreditSourceType;
import ru.oparin.omnihub.model.enums.LedgerOperation;
import ru.oparin.omnihub.model.enums.ReservationStatus;
import ru.oparin.omnihub.repository.CreditReservationRepository;
import ru.oparin.omnihub.repository.LedgerEntryRepository;
import ru.oparin.omnihub.repository.UserRepository;
import ru.oparin.omnihub.repository.WorkspaceMemberRepository;
import ru.oparin.omnihub.repository.WorkspaceRepository;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DataR2dbcTest
@ActiveProfiles("test")
@Import({CreditLedgerService.class, WorkspaceService.class})
@DisplayName("CreditLedgerService")
class CreditLedgerServiceTest {

    @Autowired
    private ConnectionFactory connectionFactory;

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private WorkspaceRepository workspaceRepository;

    @Autowired
    private WorkspaceMemberRepository workspaceMemberRepository;

    @Autowired
    private CreditReservationRepository reservationRepository;

    @Autowired
    private LedgerEntryRepository ledgerEntryRepository;

    private User user;

    @BeforeEach
    void setUp() {
        new ResourceDatabasePopulator(new ClassPathResource("schema-h2.sql")).populate(connectionFactory).block();
        ledgerEntryRepository.deleteAll().block();
        reservationRepository.deleteAll().block();
        workspaceMemberRepository.deleteAll().block();
        workspaceRepository.deleteAll().block();
        userRepository.deleteAll().block();

        user = userRepository.save(User.builder().email("ledger@omnihub.test").credits(new BigDecimal("1")).build()).block();
        workspaceRepository.save(Workspace.builder().ownerId(user.getId()).name("Личное").isDefault(true).build()).block();
    }

    @Test
    @DisplayName("Резерв и списание меньше резерва возвращают разницу источнику")
    void reserveAndSettle() {
        CreditSource source = creditLedgerService.resolveSource(user.getId(), null).block();
        assertThat(source.getType()).isEqualTo(CreditSourceType.PERSONAL);

        CreditReservation reservation = creditLedgerService.reserve(source, new BigDecimal("0.4"), 100L).block();
        assertThat(creditLedgerService.getBalance(source).block()).isEqualByComparingTo("0.6");

        StepVerifier.create(creditLedgerService.settle(reservation.getId(), new BigDecimal("0.3")))
                .assertNext(settled -> {
                    assertThat(settled.getStatus()).isEqualTo(ReservationStatus.SETTLED);
                    assertThat(settled.getSettledAmount()).isEqualByComparingTo("0.3");
                })
                .verifyComplete();

        assertThat(creditLedgerService.getBalance(source).block()).isEqualByComparingTo("0.7");
        assertThat(creditLedgerService.replayBalanceDelta(source).block()).isEqualByComparingTo("-0.3");
        StepVerifier.create(creditLedgerService.getEntries(100L).map(entry -> entry.getOperation()))
                .expectNext(LedgerOperation.RESERVE, LedgerOperation.SETTLE)
                .verifyComplete();
    }

    @Test
    @DisplayName("Повторный возврат после списания ничего не меняет")
    void secondTerminalCallIsNoOp() {
        CreditSource source = CreditSource.personal(user.getId(), null);
        CreditReservation reservation = creditLedgerService.reserve(source, new BigDecimal("0.5"), 101L).block();

        creditLedgerService.settle(reservation.getId(), new BigDecimal("0.5")).block();
        StepVerifier.create(creditLedgerService.refund(reservation.getId()))
                .assertNext(same -> assertThat(same.getStatus()).isEqualTo(ReservationStatus.SETTLED))
                .verifyComplete();

        assertThat(creditLedgerService.getBalance(source).block()).isEqualByComparingTo("0.5");
        assertThat(ledgerEntryRepository.findByReservationIdOrderByIdAsc(reservation.getId()).count().block()).isEqualTo(2);
    }

    @Test
    @DisplayName("Возврат полностью восстанавливает баланс")
    void refundRestoresBalance() {
        CreditSource source = CreditSource.personal(user.getId(), null);
        CreditReservation reservation = creditLedgerService.reserve(source, new BigDecimal("0.25"), 102L).block();

        creditLedgerService.refund(reservation.getId()).block();

        assertThat(creditLedgerService.getBalance(source).block()).isEqualByComparingTo("1");
        assertThat(creditLedgerService.replayBalanceDelta(source).block()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Списание больше резерва ограничивается резервом")
    void settleAboveReservationIsCapped() {
        CreditSource source = CreditSource.personal(user.getId(), null);
        CreditReservation reservation = creditLedgerService.reserve(source, new BigDecimal("0.2"), 103L).block();

        StepVerifier.create(creditLedgerService.settle(reservation.getId(), new BigDecimal("0.9")))
                .assertNext(settled -> assertThat(settled.getSettledAmount()).isEqualByComparingTo("0.2"))
                .verifyComplete();
        assertThat(creditLedgerService.getBalance(source).block()).isEqualByComparingTo("0.8");
    }

    @Test
    @DisplayName("Недостаточно кредитов - резерв не создается")
    void insufficientCredits() {
        CreditSource source = CreditSource.personal(user.getId(), null);

        StepVerifier.create(creditLedgerService.reserve(source, new BigDecimal("1.5"), 104L))
                .expectError(InsufficientCreditsException.class)
                .verify();

        assertThat(creditLedgerService.getBalance(source).block()).isEqualByComparingTo("1");
        assertThat(reservationRepository.count().block()).isZero();
    }

    @Test
    @DisplayName("Источник определяется режимом workspace и членством")
    void resolveSourceByWorkspaceMode() {
        User owner = userRepository.save(User.builder().email("owner@omnihub.test").build()).block();
        Workspace shared = workspaceRepository.save(Workspace.builder()
                .ownerId(owner.getId()).name("Команда").creditMode(CreditMode.SHARED).credits(new BigDecimal("10")).build()).block();
        Workspace individual = workspaceRepository.save(Workspace.builder()
                .ownerId(owner.getId()).name("Студия").creditMode(CreditMode.INDIVIDUAL).build()).block();
        workspaceMemberRepository.save(WorkspaceMember.builder()
                .workspaceId(shared.getId()).userId(user.getId()).build()).block();
        workspaceMemberRepository.save(WorkspaceMember.builder()
                .workspaceId(individual.getId()).userId(user.getId()).allocatedCredits(new BigDecimal("2")).build()).block();
        Workspace foreign = workspaceRepository.save(Workspace.builder()
                .ownerId(owner.getId()).name("Чужой").build()).block();

        StepVerifier.create(creditLedgerService.resolveSource(user.getId(), shared.getId()))
                .assertNext(source -> assertThat(source.getType()).isEqualTo(CreditSourceType.WORKSPACE))
                .verifyComplete();
        StepVerifier.create(creditLedgerService.resolveSource(user.getId(), individual.getId())
                        .flatMap(creditLedgerService::getBalance))
                .assertNext(balance -> assertThat(balance).isEqualByComparingTo("2"))
                .verifyComplete();
        StepVerifier.create(creditLedgerService.resolveSource(user.getId(), foreign.getId()))
                .expectError(AuthException.class)
                .verify();
    }
}
