package personal.salon.core.payment.domain.model;

import java.math.BigDecimal;

/**
 * 정산 결과
 *
 * @param originalAmount       할인 적용 시에만 존재
 * @param reservationConfirmed 예약 결제였다면 true
 */
public record SettlementResult(
        Long paymentId,
        BigDecimal amount,
        BigDecimal originalAmount,
        DiscountKind discountKind,
        boolean reservationConfirmed) {

    public static SettlementResult from(Payment payment) {
        return new SettlementResult(
                payment.id(),
                payment.amount(),
                payment.originalAmount(),
                payment.discountKind(),
                payment.reservationId() != null);
    }
}
