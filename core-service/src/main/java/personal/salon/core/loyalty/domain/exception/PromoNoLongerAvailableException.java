package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 정산 중 프로모션 조건부 사용 처리가 실패한 경우
 */
public class PromoNoLongerAvailableException extends BusinessException {
    public PromoNoLongerAvailableException(String code) {
        super(ErrorCode.PROMO_NO_LONGER_AVAILABLE, String.format("Promo code is no longer available: code=%s", code));
    }
}
