package personal.salon.core.payment.application.port.in;

import java.math.BigDecimal;

/**
 * 프로모션 코드 적용 미리보기 요청
 *
 * @param amount 할인 전 결제 예정 금액
 */
public record PreviewPromoCodeCommand(
        Long userId,
        Long reservationId,
        String promoCode,
        BigDecimal amount) {
}
