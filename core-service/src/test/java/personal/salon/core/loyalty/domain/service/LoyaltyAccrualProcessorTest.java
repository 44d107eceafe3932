package personal.salon.core.loyalty.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import personal.salon.core.loyalty.application.port.out.CompletedVisitPort;
import personal.salon.core.loyalty.application.port.out.LoyaltyMembershipRepository;
import personal.salon.core.loyalty.application.port.out.LoyaltyProgramRepository;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.model.AccrualResult;
import personal.salon.core.loyalty.domain.model.AvailableReward;
import personal.salon.core.loyalty.domain.model.CompletedVisit;
import personal.salon.core.loyalty.domain.model.LoyaltyMembership;
import personal.salon.core.loyalty.domain.model.LoyaltyProgram;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoyaltyAccrualProcessor 단위 테스트")
class LoyaltyAccrualProcessorTest {

    private static final Long USER_ID = 10L;
    private static final Long MERCHANT_ID = 100L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 5, 1, 12, 0);
    private static final CompletedVisit VISIT = new CompletedVisit(1L, USER_ID, MERCHANT_ID, NOW.minusHours(2));
    private static final LoyaltyProgram PROGRAM =
            new LoyaltyProgram(1L, MERCHANT_ID, 5, new BigDecimal("20.00"), true, "5회 방문 시 20%");

    @Mock
    private LoyaltyMembershipRepository membershipRepository;
    @Mock
    private LoyaltyProgramRepository programRepository;
    @Mock
    private RewardLedger rewardLedger;
    @Mock
    private CompletedVisitPort completedVisitPort;
    @Mock
    private TransactionTemplate transactionTemplate;

    private LoyaltyAccrualProcessor processor;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        given(transactionTemplate.execute(any())).willAnswer(invocation ->
                ((TransactionCallback<AccrualResult>) invocation.getArgument(0))
                        .doInTransaction(mock(TransactionStatus.class)));
        processor = new LoyaltyAccrualProcessor(membershipRepository, programRepository, rewardLedger,
                completedVisitPort, transactionTemplate,
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneId.of("UTC")));
    }

    @Test
    @DisplayName("첫 방문이면 멤버십을 생성하고 방문 수를 1로 저장한다")
    void process_FirstVisit() {
        // given
        given(membershipRepository.findForUpdate(USER_ID, MERCHANT_ID)).willReturn(Optional.empty());
        given(membershipRepository.create(any())).willAnswer(invocation -> {
            LoyaltyMembership m = invocation.getArgument(0);
            return new LoyaltyMembership(50L, m.userId(), m.merchantId(), 0, 0);
        });
        given(programRepository.findActiveByMerchant(MERCHANT_ID)).willReturn(Optional.of(PROGRAM));
        given(completedVisitPort.markProcessed(1L)).willReturn(true);

        // when
        AccrualResult result = processor.process(VISIT);

        // then
        assertThat(result.outcome()).isEqualTo(AccrualResult.Outcome.ACCRUED);
        ArgumentCaptor<LoyaltyMembership> saved = ArgumentCaptor.forClass(LoyaltyMembership.class);
        verify(membershipRepository).save(saved.capture());
        assertThat(saved.getValue().id()).isEqualTo(50L);
        assertThat(saved.getValue().visitsCount()).isEqualTo(1);
        verify(rewardLedger, never()).mint(any());
    }

    @Test
    @DisplayName("목표 도달 시 리워드를 발급하고 방문 수를 초기화한다")
    void process_MintsReward() {
        // given
        given(membershipRepository.findForUpdate(USER_ID, MERCHANT_ID))
                .willReturn(Optional.of(new LoyaltyMembership(50L, USER_ID, MERCHANT_ID, 4, 4)));
        given(programRepository.findActiveByMerchant(MERCHANT_ID)).willReturn(Optional.of(PROGRAM));
        given(rewardLedger.mint(any())).willAnswer(invocation -> {
            AvailableReward r = invocation.getArgument(0);
            return new AvailableReward(77L, r.userId(), r.merchantId(), r.discountPercentage(), r.note(),
                    r.active(), null, r.createdAt());
        });
        given(completedVisitPort.markProcessed(1L)).willReturn(true);

        // when
        AccrualResult result = processor.process(VISIT);

        // then
        assertThat(result.outcome()).isEqualTo(AccrualResult.Outcome.REWARD_MINTED);
        assertThat(result.reward().id()).isEqualTo(77L);
        assertThat(result.reward().discountPercentage()).isEqualByComparingTo("20.00");

        ArgumentCaptor<LoyaltyMembership> saved = ArgumentCaptor.forClass(LoyaltyMembership.class);
        verify(membershipRepository).save(saved.capture());
        assertThat(saved.getValue().visitsCount()).isZero();
        assertThat(saved.getValue().totalVisitsCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("다른 작업자가 먼저 처리했으면 SKIPPED")
    void process_AlreadyProcessed() {
        given(membershipRepository.findForUpdate(USER_ID, MERCHANT_ID))
                .willReturn(Optional.of(new LoyaltyMembership(50L, USER_ID, MERCHANT_ID, 1, 1)));
        given(programRepository.findActiveByMerchant(MERCHANT_ID)).willReturn(Optional.empty());
        given(completedVisitPort.markProcessed(1L)).willReturn(false);

        AccrualResult result = processor.process(VISIT);

        assertThat(result.outcome()).isEqualTo(AccrualResult.Outcome.SKIPPED);
    }

    @Test
    @DisplayName("멤버십 동시 생성 충돌은 FAILED로 격리된다")
    void process_CreateConflict() {
        given(membershipRepository.findForUpdate(USER_ID, MERCHANT_ID)).willReturn(Optional.empty());
        given(membershipRepository.create(any())).willThrow(new DataIntegrityViolationException("duplicate"));

        AccrualResult result = processor.process(VISIT);

        assertThat(result.outcome()).isEqualTo(AccrualResult.Outcome.FAILED);
        verify(completedVisitPort, never()).markProcessed(any());
    }
}
