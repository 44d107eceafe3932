package personal.salon.core.booking.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.booking.domain.model.ReservationStatus;

/**
 * 결제 대상 예약이 PENDING 상태가 아닐 때 발생
 */
public class ReservationNotPendingException extends BusinessException {

    private final ReservationStatus currentStatus;

    public ReservationNotPendingException(ReservationStatus currentStatus) {
        super(ErrorCode.RESERVATION_NOT_PENDING,
                String.format("Cannot process payment for reservation with status '%s'. "
                        + "Reservation must be in PENDING status.", currentStatus));
        this.currentStatus = currentStatus;
    }

    public ReservationStatus getCurrentStatus() {
        return currentStatus;
    }
}
