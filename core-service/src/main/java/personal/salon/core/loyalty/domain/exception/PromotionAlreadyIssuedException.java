package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 같은 고객/매장에 동일 코드가 이미 발급된 경우
 */
public class PromotionAlreadyIssuedException extends BusinessException {
    public PromotionAlreadyIssuedException(String code) {
        super(ErrorCode.PROMOTION_ALREADY_ISSUED, String.format("Promo code already issued: code=%s", code));
    }
}
