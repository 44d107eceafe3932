package personal.salon.core.loyalty.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.salon.core.loyalty.application.port.in.ExpirePromotionsUseCase;
import personal.salon.core.loyalty.application.port.out.SweepLockPort;
import personal.salon.core.loyalty.domain.model.Sweep;

/**
 * Promotion Expiry Scheduler (Driving Adapter)
 * 만료 시각이 지난 ISSUED 프로모션을 EXPIRED로 정리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromotionExpiryScheduler {

    private final ExpirePromotionsUseCase expirePromotionsUseCase;
    private final SweepLockPort sweepLockPort;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: loyalty.promotion-expiry.interval-ms (기본 5분)
     */
    @Scheduled(fixedDelayString = "${loyalty.promotion-expiry.interval-ms:300000}")
    public void expirePromotions() {
        if (!sweepLockPort.tryAcquire(Sweep.PROMOTION_EXPIRY)) {
            log.debug("Skipping promotion expiry (another run holds the lock)");
            return;
        }

        try {
            int expired = expirePromotionsUseCase.expireOverduePromotions();
            if (expired > 0) {
                Counter.builder("loyalty.promotions.expired")
                        .description("Number of promotions moved to EXPIRED")
                        .register(meterRegistry)
                        .increment(expired);
            }
        } catch (Exception e) {
            log.error("Promotion expiry sweep failed", e);
        } finally {
            sweepLockPort.release(Sweep.PROMOTION_EXPIRY);
        }
    }
}
