package personal.salon.core.payment.application.port.out;

import personal.salon.core.booking.domain.model.Reservation;

/**
 * Reservation Validation Port
 * 결제를 위한 예약 검증 책임
 */
public interface ReservationValidationPort {

    /**
     * 결제를 위한 예약 검증
     * - 예약 존재 여부
     * - 소유권 검증
     * - 상태 검증 (PENDING)
     *
     * @param reservationId 예약 ID
     * @param userId        사용자 ID
     * @return 검증된 예약
     */
    Reservation validateForPayment(Long reservationId, Long userId);
}
