package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 프로모션 코드가 없거나, 다른 고객/매장 소유이거나, 이미 사용된 경우
 */
public class PromoNotFoundException extends BusinessException {
    public PromoNotFoundException(String code) {
        super(ErrorCode.PROMO_NOT_FOUND, String.format("Promo code not found: code=%s", code));
    }
}
