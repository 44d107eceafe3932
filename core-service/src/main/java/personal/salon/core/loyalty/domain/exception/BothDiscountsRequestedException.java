package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 리워드와 프로모션 코드를 동시에 요청한 경우
 */
public class BothDiscountsRequestedException extends BusinessException {
    public BothDiscountsRequestedException() {
        super(ErrorCode.BOTH_DISCOUNTS_REQUESTED, "Cannot apply both a loyalty reward and a promo code");
    }
}
