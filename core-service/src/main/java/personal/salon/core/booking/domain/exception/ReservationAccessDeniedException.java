package personal.salon.core.booking.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 다른 사용자의 예약에 접근할 때 발생
 */
public class ReservationAccessDeniedException extends BusinessException {
    public ReservationAccessDeniedException(Long reservationId) {
        super(ErrorCode.RESERVATION_ACCESS_DENIED,
                String.format("Reservation does not belong to you: reservationId=%d", reservationId));
    }
}
