package personal.salon.core.payment.domain.model;

import personal.salon.core.payment.domain.exception.DiscountedAmountTooLowException;
import personal.salon.core.payment.domain.exception.InvalidPaymentAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 결제 금액 (소수점 2자리, 최소 0.01)
 */
public record PaymentAmount(BigDecimal value) {

    public static final BigDecimal MINIMUM = new BigDecimal("0.01");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PaymentAmount {
        if (value == null || value.compareTo(MINIMUM) < 0) {
            throw new InvalidPaymentAmountException("Amount must be at least 0.01");
        }
        value = value.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * 요청 금액 검증 후 2자리 반올림
     */
    public static PaymentAmount of(BigDecimal raw) {
        if (raw == null || raw.signum() <= 0) {
            throw new InvalidPaymentAmountException("Invalid amount. Must be a positive number");
        }
        BigDecimal rounded = raw.setScale(2, RoundingMode.HALF_UP);
        if (rounded.compareTo(MINIMUM) < 0) {
            throw new InvalidPaymentAmountException("Amount must be at least 0.01");
        }
        return new PaymentAmount(rounded);
    }

    /**
     * round(amount × (1 − pct/100), 2)
     *
     * @throws DiscountedAmountTooLowException 할인 후 금액이 0.01 미만
     */
    public PaymentAmount discountedBy(BigDecimal percentage) {
        BigDecimal factor = BigDecimal.ONE.subtract(percentage.divide(HUNDRED, 10, RoundingMode.HALF_UP));
        BigDecimal discounted = value.multiply(factor).setScale(2, RoundingMode.HALF_UP);
        if (discounted.compareTo(MINIMUM) < 0) {
            throw new DiscountedAmountTooLowException(discounted);
        }
        return new PaymentAmount(discounted);
    }
}
