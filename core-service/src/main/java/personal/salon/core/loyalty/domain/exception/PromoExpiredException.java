package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 만료된 프로모션 코드
 */
public class PromoExpiredException extends BusinessException {
    public PromoExpiredException(String code) {
        super(ErrorCode.PROMO_EXPIRED, String.format("Promo code has expired: code=%s", code));
    }
}
