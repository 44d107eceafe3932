package personal.salon.core.loyalty.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
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

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Loyalty Accrual Processor (Transaction Manager)
 * 완료된 방문 1건을 독립 트랜잭션으로 적립 처리한다.
 * <p>
 * 처리 순서:
 * 1. 멤버십 행 배타 잠금 (없으면 0회로 생성)
 * 2. 방문 수 +1
 * 3. 매장 활성 프로그램 조회
 * 4. 목표 도달 시 리워드 발급 + 초과분만 남기고 차감
 * 5. 예약 적립 처리 표시
 * <p>
 * 실패는 예외가 아닌 AccrualResult로 반환하여 스윕을 중단시키지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoyaltyAccrualProcessor {

    private final LoyaltyMembershipRepository membershipRepository;
    private final LoyaltyProgramRepository programRepository;
    private final RewardLedger rewardLedger;
    private final CompletedVisitPort completedVisitPort;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AccrualResult process(CompletedVisit visit) {
        try {
            AccrualResult result = transactionTemplate.execute(status -> accrueInTransaction(visit));
            if (result == null) {
                return AccrualResult.failed(visit.reservationId(), "Transaction returned no result");
            }
            return result;
        } catch (VisitAlreadyProcessedException e) {
            log.warn("Visit already processed by another worker: reservationId={}", visit.reservationId());
            return AccrualResult.skipped(visit.reservationId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Loyalty accrual failed: reservationId={}, userId={}, merchantId={}",
                    visit.reservationId(), visit.customerId(), visit.merchantId(), e);
            return AccrualResult.failed(visit.reservationId(), e.getMessage());
        }
    }

    private AccrualResult accrueInTransaction(CompletedVisit visit) {
        // 1. 멤버십 잠금 (지연 생성)
        LoyaltyMembership membership = membershipRepository
                .findForUpdate(visit.customerId(), visit.merchantId())
                .orElseGet(() -> membershipRepository.create(
                        LoyaltyMembership.start(visit.customerId(), visit.merchantId())));

        // 2~3. 방문 적립 + 프로그램 조회
        LoyaltyProgram program = programRepository.findActiveByMerchant(visit.merchantId()).orElse(null);
        LoyaltyMembership.AccrualDecision decision = membership.accrue(program);
        membershipRepository.save(decision.membership());

        // 4. 리워드 발급
        AvailableReward minted = null;
        if (decision.rewardEarned()) {
            minted = rewardLedger.mint(AvailableReward.mint(visit.customerId(), program, LocalDateTime.now(clock)));
            log.info("Reward minted: rewardId={}, userId={}, merchantId={}, remainingVisits={}",
                    minted.id(), visit.customerId(), visit.merchantId(), decision.membership().visitsCount());
        }

        // 5. 적립 처리 표시 (실패 시 전체 롤백)
        if (!completedVisitPort.markProcessed(visit.reservationId())) {
            throw new VisitAlreadyProcessedException(visit.reservationId());
        }

        log.debug("Visit accrued: reservationId={}, visits={}, total={}",
                visit.reservationId(), decision.membership().visitsCount(),
                decision.membership().totalVisitsCount());

        return minted != null
                ? AccrualResult.minted(visit.reservationId(), minted)
                : AccrualResult.accrued(visit.reservationId());
    }

    /**
     * 적립 처리 표시 조건부 갱신이 실패했을 때 트랜잭션을 롤백시키기 위한 내부 예외
     */
    static class VisitAlreadyProcessedException extends RuntimeException {
        VisitAlreadyProcessedException(Long reservationId) {
            super("Visit already marked as processed: reservationId=" + reservationId);
        }
    }
}
