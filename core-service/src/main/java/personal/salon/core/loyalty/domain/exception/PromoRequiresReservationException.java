package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 예약이 아닌 주문 결제에 프로모션 코드를 사용한 경우
 */
public class PromoRequiresReservationException extends BusinessException {
    public PromoRequiresReservationException() {
        super(ErrorCode.PROMO_REQUIRES_RESERVATION, "Promo codes can only be applied to reservations");
    }
}
