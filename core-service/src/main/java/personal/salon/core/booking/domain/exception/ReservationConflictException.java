package personal.salon.core.booking.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 결제 확정 중 예약 상태가 동시에 변경되어 조건부 전이가 실패했을 때 발생
 */
public class ReservationConflictException extends BusinessException {
    public ReservationConflictException(Long reservationId) {
        super(ErrorCode.RESERVATION_CONFLICT,
                String.format("Reservation status changed while confirming payment: reservationId=%d",
                        reservationId));
    }
}
