package personal.salon.core.payment.application.port.in;

import personal.salon.core.payment.domain.model.DiscountRequest;

import java.math.BigDecimal;

/**
 * 결제 정산 요청
 *
 * @param userId 인증된 요청자 (필수)
 */
public record SettlePaymentCommand(
        Long userId,
        Long creditCardId,
        Long billingAddressId,
        BigDecimal amount,
        Long reservationId,
        Long orderId,
        Long rewardId,
        String promoCode) {

    public DiscountRequest discountRequest() {
        return new DiscountRequest(rewardId, promoCode);
    }
}
