package personal.salon.core.payment.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * 할인 적용 후 금액이 최소 결제 금액(0.01) 미만인 경우
 */
public class DiscountedAmountTooLowException extends BusinessException {
    public DiscountedAmountTooLowException(BigDecimal discounted) {
        super(ErrorCode.DISCOUNTED_AMOUNT_TOO_LOW,
                String.format("Discounted amount %s is below the minimum of 0.01", discounted.toPlainString()));
    }
}
