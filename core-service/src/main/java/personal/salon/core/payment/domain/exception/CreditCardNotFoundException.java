package personal.salon.core.payment.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 카드가 없거나 요청자 소유가 아닌 경우 (두 경우를 구분하지 않는다)
 */
public class CreditCardNotFoundException extends BusinessException {
    public CreditCardNotFoundException() {
        super(ErrorCode.CREDIT_CARD_NOT_FOUND, "Credit card not found or does not belong to you");
    }
}
