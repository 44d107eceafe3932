package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 할인율이 (0, 100] 범위를 벗어난 경우
 */
public class InvalidDiscountPercentageException extends BusinessException {
    public InvalidDiscountPercentageException(Object percentage) {
        super(ErrorCode.INVALID_DISCOUNT_PERCENTAGE, String.format("Discount percentage must be greater than 0 and at most 100: %s", percentage));
    }
}
