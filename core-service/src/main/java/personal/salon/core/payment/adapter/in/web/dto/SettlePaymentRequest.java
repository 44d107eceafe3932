package personal.salon.core.payment.adapter.in.web.dto;

import personal.salon.core.payment.application.port.in.SettlePaymentCommand;

import java.math.BigDecimal;

/**
 * 결제 정산 요청 DTO
 * 필수 값 검증은 정산 서비스에서 순서대로 수행한다.
 */
public record SettlePaymentRequest(
        Long creditCardId,
        Long billingAddressId,
        BigDecimal amount,
        Long reservationId,
        Long orderId,
        Long rewardId,
        String promoCode) {

    public SettlePaymentCommand toCommand(Long userId) {
        return new SettlePaymentCommand(userId, creditCardId, billingAddressId, amount,
                reservationId, orderId, rewardId, promoCode);
    }
}
