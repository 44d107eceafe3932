package personal.salon.core.payment.application.port.out;

import personal.salon.core.booking.domain.model.Reservation;

/**
 * 결제 완료에 따른 예약 상태 전이 (PENDING일 때만)
 */
public interface ReservationConfirmationPort {

    /**
     * @return 정확히 한 건이 전이되었으면 true
     */
    boolean confirmSettled(Reservation reservation);
}
