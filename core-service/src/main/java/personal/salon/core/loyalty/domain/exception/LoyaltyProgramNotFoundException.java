package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 매장에 활성 적립 프로그램이 없는 경우
 */
public class LoyaltyProgramNotFoundException extends BusinessException {
    public LoyaltyProgramNotFoundException(Long merchantId) {
        super(ErrorCode.LOYALTY_PROGRAM_NOT_FOUND, String.format("No loyalty program found: merchantId=%d", merchantId));
    }
}
