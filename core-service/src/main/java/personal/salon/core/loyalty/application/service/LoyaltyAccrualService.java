package personal.salon.core.loyalty.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.core.loyalty.application.port.in.RunLoyaltyAccrualUseCase;
import personal.salon.core.loyalty.application.port.out.CompletedVisitPort;
import personal.salon.core.loyalty.domain.model.AccrualResult;
import personal.salon.core.loyalty.domain.model.AccrualSweepSummary;
import personal.salon.core.loyalty.domain.model.AvailableReward;
import personal.salon.core.loyalty.domain.model.CompletedVisit;
import personal.salon.core.loyalty.domain.service.LoyaltyAccrualProcessor;
import personal.salon.core.notification.application.port.in.RequestNotificationUseCase;
import personal.salon.core.notification.domain.model.NotificationCategory;
import personal.salon.core.notification.domain.model.NotificationRequest;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Loyalty Accrual Service
 * 적립 스윕 1회: 완료 방문을 건별로 적립한 뒤 취소 예약을 일괄 확인 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoyaltyAccrualService implements RunLoyaltyAccrualUseCase {

    private final CompletedVisitPort completedVisitPort;
    private final LoyaltyAccrualProcessor accrualProcessor;
    private final RequestNotificationUseCase requestNotificationUseCase;
    private final Clock clock;

    @Override
    public AccrualSweepSummary runAccrual() {
        List<CompletedVisit> visits = completedVisitPort.findUnprocessed(LocalDateTime.now(clock));

        int accrued = 0;
        int minted = 0;
        int skipped = 0;
        int failed = 0;

        for (CompletedVisit visit : visits) {
            AccrualResult result = accrualProcessor.process(visit);
            switch (result.outcome()) {
                case ACCRUED -> accrued++;
                case REWARD_MINTED -> {
                    minted++;
                    notifyRewardEarned(visit, result.reward());
                }
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        // 취소 예약: 잠금 없이 일괄 확인 처리 (적립 없음)
        int canceledMarked = completedVisitPort.markCanceledProcessed();

        AccrualSweepSummary summary = new AccrualSweepSummary(
                visits.size(), accrued, minted, skipped, failed, canceledMarked);
        if (!summary.isIdle()) {
            log.info("Loyalty accrual sweep completed: candidates={}, accrued={}, minted={}, skipped={}, "
                            + "failed={}, canceledMarked={}",
                    summary.candidates(), accrued, minted, skipped, failed, canceledMarked);
        }
        return summary;
    }

    private void notifyRewardEarned(CompletedVisit visit, AvailableReward reward) {
        try {
            requestNotificationUseCase.request(new NotificationRequest(
                    visit.customerId(),
                    NotificationCategory.REWARD_EARNED,
                    String.format("You earned a %s%% discount reward! Use it on your next visit.",
                            reward.discountPercentage().stripTrailingZeros().toPlainString()),
                    visit.merchantId(),
                    visit.reservationId(),
                    null));
        } catch (RuntimeException e) {
            log.warn("Failed to request reward notification: rewardId={}, userId={}",
                    reward.id(), visit.customerId(), e);
        }
    }
}
