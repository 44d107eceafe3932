package personal.salon.core.booking.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.booking.domain.model.ReservationEvent;
import personal.salon.core.booking.domain.model.ReservationStatus;

/**
 * Invalid Reservation Transition Exception
 * 상태 전이표에 없는 전이를 시도할 때 발생
 */
public class InvalidReservationTransitionException extends BusinessException {
    public InvalidReservationTransitionException(ReservationStatus currentStatus, ReservationEvent event) {
        super(ErrorCode.CONFLICT,
                String.format("예약 상태 %s에서 %s 이벤트를 처리할 수 없습니다.", currentStatus, event));
    }
}
