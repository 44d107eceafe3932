package personal.salon.core.payment.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.ActiveProfiles;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.booking.adapter.out.persistence.JpaReservationRepository;
import personal.salon.core.booking.adapter.out.persistence.ReservationEntity;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.booking.domain.model.ReservationStatus;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.model.AvailableReward;
import personal.salon.core.loyalty.domain.model.LoyaltyProgram;
import personal.salon.core.payment.adapter.out.booking.ReleaseExecutorConfig;
import personal.salon.core.payment.application.port.in.SettlePaymentCommand;
import personal.salon.core.payment.application.port.in.SettlePaymentUseCase;
import personal.salon.core.payment.domain.model.PaymentAmount;
import personal.salon.core.payment.domain.model.ResolvedDiscount;
import personal.salon.core.payment.domain.model.SettlementPlan;
import personal.salon.core.payment.domain.model.SettlementTarget;
import personal.salon.core.payment.domain.service.SettlementManager;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 동시 정산 테스트
 * 같은 리워드 또는 같은 예약을 두고 여러 요청이 동시에 정산될 때 조건부 갱신이 한 건만 통과하는지 검증한다.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@DisplayName("결제 정산 동시성 테스트")
class PaymentSettlementConcurrencyTest {

    private static final Long USER_ID = 10L;
    private static final Long MERCHANT_ID = 100L;
    private static final String SUCCESS = "SUCCESS";

    @Autowired
    private SettlePaymentUseCase settlePaymentUseCase;
    @Autowired
    private SettlementManager settlementManager;
    @Autowired
    private RewardLedger rewardLedger;
    @Autowired
    private JpaReservationRepository jpaReservationRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    @Qualifier(ReleaseExecutorConfig.RELEASE_EXECUTOR)
    private Executor releaseExecutor;

    private Long creditCardId;
    private Long billingAddressId;

    @BeforeEach
    void setUp() {
        clearTables();
        creditCardId = insert("credit_cards", Map.of("user_id", USER_ID, "card_last4", "4242"));
        billingAddressId = insert("billing_addresses",
                Map.of("user_id", USER_ID, "address_line", "Seoul", "postal_code", "04524"));
    }

    @AfterEach
    void tearDown() {
        awaitReleasesDrained();
        clearTables();
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("할인 확정 후 같은 리워드로 동시에 정산하면 한 건만 성공하고 나머지는 RewardNoLongerAvailable을 받는다")
    void sameReward_ResolvedPlansRace() throws InterruptedException {
        // given: 모든 요청이 할인 확인을 통과한 상태 (각자 다른 결제 대기 예약)
        int threads = 6;
        Long rewardId = mintReward(new BigDecimal("20"));
        List<SettlementPlan> plans = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Reservation reservation = savePendingReservation();
            plans.add(new SettlementPlan(USER_ID, creditCardId, billingAddressId, SettlementTarget.of(reservation),
                    PaymentAmount.of(new BigDecimal("100.00")), PaymentAmount.of(new BigDecimal("80.00")),
                    ResolvedDiscount.reward(rewardId, new BigDecimal("20"))));
        }

        // when
        Map<String, AtomicInteger> outcomes = race(threads, i -> () -> settlementManager.settle(plans.get(i)));

        // then
        assertThat(count(outcomes, SUCCESS)).isEqualTo(1);
        assertThat(count(outcomes, ErrorCode.REWARD_NO_LONGER_AVAILABLE.name())).isEqualTo(threads - 1);
        assertThat(paymentsUsingReward(rewardId)).isEqualTo(1);
        assertThat(rewardLedger.findRedeemable(rewardId, USER_ID, MERCHANT_ID)).isEmpty();
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("같은 리워드로 동시에 결제하면 한 건만 성공하고 리워드 사용 결제는 하나뿐이다")
    void sameReward_SettleRequestsRace() throws InterruptedException {
        // given
        int threads = 6;
        Long rewardId = mintReward(new BigDecimal("20"));
        List<Long> reservationIds = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            reservationIds.add(savePendingReservation().id());
        }

        // when
        Map<String, AtomicInteger> outcomes = race(threads,
                i -> () -> settlePaymentUseCase.settle(command(reservationIds.get(i), rewardId)));

        // then: 커밋 이후에 조회한 요청은 사용 불가 리워드로 거절된다
        assertThat(count(outcomes, SUCCESS)).isEqualTo(1);
        assertThat(count(outcomes, ErrorCode.REWARD_NO_LONGER_AVAILABLE.name())
                + count(outcomes, ErrorCode.REWARD_NOT_ELIGIBLE.name())).isEqualTo(threads - 1);
        assertThat(paymentsUsingReward(rewardId)).isEqualTo(1);

        // 실패한 요청의 결제 대기 예약은 해제된다
        awaitReleasesDrained();
        assertThat(reservationIds.stream().filter(jpaReservationRepository::existsById)).hasSize(1);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("같은 결제 대기 예약을 동시에 정산하면 한 건만 SCHEDULED가 되고 나머지는 ReservationConflict를 받는다")
    void samePendingReservation_ResolvedPlansRace() throws InterruptedException {
        // given
        int threads = 4;
        Reservation reservation = savePendingReservation();
        SettlementPlan plan = new SettlementPlan(USER_ID, creditCardId, billingAddressId,
                SettlementTarget.of(reservation), PaymentAmount.of(new BigDecimal("100.00")),
                PaymentAmount.of(new BigDecimal("100.00")), ResolvedDiscount.none());

        // when
        Map<String, AtomicInteger> outcomes = race(threads, i -> () -> settlementManager.settle(plan));

        // then
        assertThat(count(outcomes, SUCCESS)).isEqualTo(1);
        assertThat(count(outcomes, ErrorCode.RESERVATION_CONFLICT.name())).isEqualTo(threads - 1);
        assertThat(statusOf(reservation.id())).isEqualTo(ReservationStatus.SCHEDULED);
        assertThat(paymentsForReservation(reservation.id())).isEqualTo(1);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("같은 예약을 동시에 결제하면 패배한 요청의 해제는 확정된 예약을 지우지 않는다")
    void samePendingReservation_SettleRequestsRace() throws InterruptedException {
        // given
        int threads = 4;
        Long reservationId = savePendingReservation().id();

        // when
        Map<String, AtomicInteger> outcomes = race(threads,
                i -> () -> settlePaymentUseCase.settle(command(reservationId, null)));

        // then: 검증 단계에서 늦은 요청은 B002, 원자 단위에서 진 요청은 B004
        assertThat(count(outcomes, SUCCESS)).isEqualTo(1);
        assertThat(count(outcomes, ErrorCode.RESERVATION_CONFLICT.name())
                + count(outcomes, ErrorCode.RESERVATION_NOT_PENDING.name())).isEqualTo(threads - 1);

        awaitReleasesDrained();
        assertThat(jpaReservationRepository.existsById(reservationId)).isTrue();
        assertThat(statusOf(reservationId)).isEqualTo(ReservationStatus.SCHEDULED);
        assertThat(paymentsForReservation(reservationId)).isEqualTo(1);
    }

    // ==========================================
    // helpers
    // ==========================================

    private Map<String, AtomicInteger> race(int threads, IntFunction<Runnable> task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completeLatch = new CountDownLatch(threads);
        Map<String, AtomicInteger> outcomes = new ConcurrentHashMap<>();

        for (int i = 0; i < threads; i++) {
            Runnable settlement = task.apply(i);
            executor.submit(() -> {
                try {
                    startLatch.await();
                    settlement.run();
                    outcomes.computeIfAbsent(SUCCESS, k -> new AtomicInteger()).incrementAndGet();
                } catch (BusinessException e) {
                    outcomes.computeIfAbsent(e.getErrorCode().name(), k -> new AtomicInteger()).incrementAndGet();
                } catch (Exception e) {
                    outcomes.computeIfAbsent(e.getClass().getSimpleName(), k -> new AtomicInteger())
                            .incrementAndGet();
                } finally {
                    completeLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(completeLatch.await(20, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        return outcomes;
    }

    private int count(Map<String, AtomicInteger> outcomes, String key) {
        AtomicInteger value = outcomes.get(key);
        return value == null ? 0 : value.get();
    }

    private SettlePaymentCommand command(Long reservationId, Long rewardId) {
        return new SettlePaymentCommand(USER_ID, creditCardId, billingAddressId, new BigDecimal("100.00"),
                reservationId, null, rewardId, null);
    }

    private Reservation savePendingReservation() {
        LocalDateTime start = LocalDateTime.now().plusDays(1);
        Reservation reservation = new Reservation(null, USER_ID, MERCHANT_ID, start, start.plusHours(1),
                ReservationStatus.PENDING, null, Set.of(), LocalDateTime.now());
        return jpaReservationRepository.saveAndFlush(ReservationEntity.fromDomain(reservation)).toDomain();
    }

    private Long mintReward(BigDecimal percentage) {
        LoyaltyProgram program = new LoyaltyProgram(null, MERCHANT_ID, 5, percentage, true, null);
        return rewardLedger.mint(AvailableReward.mint(USER_ID, program, LocalDateTime.now())).id();
    }

    private ReservationStatus statusOf(Long reservationId) {
        return jpaReservationRepository.findById(reservationId).orElseThrow().toDomain().status();
    }

    private int paymentsUsingReward(Long rewardId) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM payments WHERE reward_id = ?", Integer.class,
                rewardId);
    }

    private int paymentsForReservation(Long reservationId) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM payments WHERE reservation_id = ?",
                Integer.class, reservationId);
    }

    private void awaitReleasesDrained() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) releaseExecutor;
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(50))
                .until(() -> executor.getActiveCount() == 0
                        && executor.getThreadPoolExecutor().getQueue().isEmpty());
    }

    private Long insert(String table, Map<String, Object> columns) {
        return new SimpleJdbcInsert(jdbcTemplate)
                .withTableName(table)
                .usingGeneratedKeyColumns("id")
                .executeAndReturnKey(columns)
                .longValue();
    }

    private void clearTables() {
        List.of("reservation_staff", "reservations", "payments", "available_rewards", "user_promotions",
                        "credit_cards", "billing_addresses", "outbox_events")
                .forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
    }
}
