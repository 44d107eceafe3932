package personal.salon.core.payment.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 결제 금액이 없거나 0 이하, 또는 0.01 미만인 경우
 */
public class InvalidPaymentAmountException extends BusinessException {
    public InvalidPaymentAmountException(String message) {
        super(ErrorCode.INVALID_PAYMENT_AMOUNT, message);
    }
}
