package personal.salon.core.payment.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment Domain Model
 * 불변 정산 기록. 성공한 정산마다 정확히 한 번 생성되고 수정되지 않는다.
 *
 * @param originalAmount 할인 전 금액 (할인이 없으면 null)
 * @param rewardId       사용한 리워드 (promotionId와 동시에 존재할 수 없음)
 * @param promotionId    사용한 프로모션
 */
public record Payment(
        Long id,
        Long userId,
        Long creditCardId,
        Long billingAddressId,
        Long reservationId,
        Long orderId,
        Long merchantId,
        BigDecimal amount,
        BigDecimal originalAmount,
        DiscountKind discountKind,
        Long rewardId,
        Long promotionId,
        PaymentStatus status,
        LocalDateTime createdAt) {

    public Payment {
        if (amount == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment amount cannot be null");
        }
        if ((reservationId == null) == (orderId == null)) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_TARGET,
                    "Exactly one of reservationId or orderId must be provided");
        }
        if (rewardId != null && promotionId != null) {
            throw new BusinessException(ErrorCode.BOTH_DISCOUNTS_REQUESTED,
                    "A payment can reference at most one of reward or promotion");
        }
        if (discountKind == null) {
            discountKind = DiscountKind.NONE;
        }
        if (status == null) {
            status = PaymentStatus.SUCCEEDED;
        }
    }

    /**
     * 정산 계획으로부터 결제 기록 생성 (저장 전, id 없음)
     */
    public static Payment settle(SettlementPlan plan, LocalDateTime now) {
        ResolvedDiscount discount = plan.discount();
        return new Payment(
                null,
                plan.userId(),
                plan.creditCardId(),
                plan.billingAddressId(),
                plan.target().reservationId(),
                plan.target().orderId(),
                plan.target().merchantId(),
                plan.chargedAmount().value(),
                discount.isApplied() ? plan.originalAmount().value() : null,
                discount.kind(),
                discount.kind() == DiscountKind.REWARD ? discount.sourceId() : null,
                discount.kind() == DiscountKind.PROMO ? discount.sourceId() : null,
                PaymentStatus.SUCCEEDED,
                now);
    }
}
