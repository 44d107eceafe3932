package personal.salon.core.payment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.core.booking.domain.exception.ReservationConflictException;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.exception.PromoNoLongerAvailableException;
import personal.salon.core.loyalty.domain.exception.RewardNoLongerAvailableException;
import personal.salon.core.payment.application.port.out.PaymentRepository;
import personal.salon.core.payment.application.port.out.ReservationConfirmationPort;
import personal.salon.core.payment.domain.exception.SettlementFailedException;
import personal.salon.core.payment.domain.model.DiscountKind;
import personal.salon.core.payment.domain.model.Payment;
import personal.salon.core.payment.domain.model.ResolvedDiscount;
import personal.salon.core.payment.domain.model.SettlementPlan;
import personal.salon.core.payment.domain.model.SettlementTarget;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Settlement Manager
 * 정산 원자 단위: 결제 기록, 할인 사용, 예약 확정을 하나의 트랜잭션으로 처리한다.
 * 조건부 갱신 중 하나라도 실패하면 예외를 던져 전체를 롤백한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementManager {

    private final PaymentRepository paymentRepository;
    private final RewardLedger rewardLedger;
    private final PromotionLedger promotionLedger;
    private final ReservationConfirmationPort reservationConfirmationPort;
    private final Clock clock;

    @Transactional
    public Payment settle(SettlementPlan plan) {
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. 결제 기록 (프로모션 사용 내역에 결제 ID가 필요하므로 먼저 저장)
        Payment payment = paymentRepository.save(Payment.settle(plan, now));
        if (payment == null || payment.id() == null) {
            log.error("Payment repository returned no id: userId={}", plan.userId());
            throw new SettlementFailedException("Failed to process payment");
        }

        // 2. 할인 사용 처리
        ResolvedDiscount discount = plan.discount();
        SettlementTarget target = plan.target();
        if (discount.kind() == DiscountKind.REWARD) {
            boolean redeemed = rewardLedger.redeem(discount.sourceId(), plan.userId(), target.merchantId(), now);
            if (!redeemed) {
                log.warn("Reward redeem lost the race: rewardId={}, userId={}", discount.sourceId(), plan.userId());
                throw new RewardNoLongerAvailableException(discount.sourceId());
            }
        } else if (discount.kind() == DiscountKind.PROMO) {
            boolean redeemed = promotionLedger.redeem(discount.sourceId(), plan.userId(), target.merchantId(),
                    now, target.reservationId(), payment.id());
            if (!redeemed) {
                log.warn("Promo redeem lost the race: code={}, userId={}", discount.promoCode(), plan.userId());
                throw new PromoNoLongerAvailableException(discount.promoCode());
            }
        }

        // 3. 예약 확정 (PENDING일 때만)
        if (target.isReservation() && !reservationConfirmationPort.confirmSettled(target.reservation())) {
            log.warn("Reservation confirm lost the race: reservationId={}", target.reservationId());
            throw new ReservationConflictException(target.reservationId());
        }

        log.info("Payment settled: paymentId={}, userId={}, amount={}, discount={}",
                payment.id(), plan.userId(), payment.amount(), discount.kind());
        return payment;
    }
}
