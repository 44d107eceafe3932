package personal.salon.core.payment.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

public class OrderAccessDeniedException extends BusinessException {
    public OrderAccessDeniedException(Long orderId) {
        super(ErrorCode.ORDER_ACCESS_DENIED, String.format("Order does not belong to you: orderId=%d", orderId));
    }
}
