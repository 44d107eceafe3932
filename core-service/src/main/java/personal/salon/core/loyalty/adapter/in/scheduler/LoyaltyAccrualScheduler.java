package personal.salon.core.loyalty.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.salon.core.loyalty.application.port.in.RunLoyaltyAccrualUseCase;
import personal.salon.core.loyalty.application.port.out.SweepLockPort;
import personal.salon.core.loyalty.domain.model.AccrualSweepSummary;
import personal.salon.core.loyalty.domain.model.Sweep;

/**
 * Loyalty Accrual Scheduler (Driving Adapter)
 * 고정 주기로 적립 스윕을 1회씩 실행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoyaltyAccrualScheduler {

    private final RunLoyaltyAccrualUseCase runLoyaltyAccrualUseCase;
    private final SweepLockPort sweepLockPort;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: loyalty.accrual.interval-ms (기본 2분)
     */
    @Scheduled(fixedDelayString = "${loyalty.accrual.interval-ms:120000}")
    public void runAccrual() {
        if (!sweepLockPort.tryAcquire(Sweep.LOYALTY_ACCRUAL)) {
            Counter.builder("loyalty.sweep.skipped")
                    .tag("sweep", Sweep.LOYALTY_ACCRUAL.key())
                    .description("Sweeps skipped because another run holds the lock")
                    .register(meterRegistry)
                    .increment();
            log.debug("Skipping loyalty accrual (another run holds the lock)");
            return;
        }

        try {
            AccrualSweepSummary summary = runLoyaltyAccrualUseCase.runAccrual();
            record(summary);
        } catch (Exception e) {
            log.error("Loyalty accrual sweep failed", e);
        } finally {
            sweepLockPort.release(Sweep.LOYALTY_ACCRUAL);
        }
    }

    private void record(AccrualSweepSummary summary) {
        increment("loyalty.accrual.visits", "accrued", summary.accrued() + summary.minted());
        increment("loyalty.accrual.rewards.minted", null, summary.minted());
        increment("loyalty.accrual.visits", "skipped", summary.skipped());
        increment("loyalty.accrual.visits", "failed", summary.failed());
        increment("loyalty.accrual.canceled.marked", null, summary.canceledMarked());
    }

    private void increment(String name, String outcome, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter.Builder builder = Counter.builder(name);
        if (outcome != null) {
            builder.tag("outcome", outcome);
        }
        builder.register(meterRegistry).increment(amount);
    }
}
