package personal.salon.core.booking.domain.model;

import personal.salon.core.booking.domain.exception.InvalidReservationTransitionException;

/**
 * Reservation Status Enum
 * 예약 상태와 상태 전이표
 */
public enum ReservationStatus {
    /**
     * 임시 예약 (결제 대기 중, 시간대 점유)
     */
    PENDING,

    /**
     * 결제 완료 (확정)
     */
    SCHEDULED,

    /**
     * 방문 완료
     */
    COMPLETED,

    /**
     * 취소
     */
    CANCELED;

    /**
     * 상태 전이 (순수 함수)
     *
     * @param event 발생한 이벤트
     * @return 전이된 상태
     * @throws InvalidReservationTransitionException 허용되지 않은 전이
     */
    public ReservationStatus next(ReservationEvent event) {
        switch (event) {
            case PAYMENT_SETTLED:
                if (this == PENDING) {
                    return SCHEDULED;
                }
                break;
            case VISIT_COMPLETED:
                if (this == SCHEDULED) {
                    return COMPLETED;
                }
                break;
            case CANCEL:
                if (this == PENDING || this == SCHEDULED) {
                    return CANCELED;
                }
                break;
            default:
                break;
        }
        throw new InvalidReservationTransitionException(this, event);
    }

    public boolean canApply(ReservationEvent event) {
        try {
            next(event);
            return true;
        } catch (InvalidReservationTransitionException e) {
            return false;
        }
    }
}
