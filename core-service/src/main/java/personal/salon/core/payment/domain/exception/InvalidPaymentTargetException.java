package personal.salon.core.payment.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

public class InvalidPaymentTargetException extends BusinessException {
    public InvalidPaymentTargetException() {
        super(ErrorCode.INVALID_PAYMENT_TARGET, "Exactly one of reservationId or orderId must be provided");
    }
}
