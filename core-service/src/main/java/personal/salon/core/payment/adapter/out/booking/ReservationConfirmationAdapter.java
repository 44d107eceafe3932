package personal.salon.core.payment.adapter.out.booking;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.core.booking.application.port.out.ReservationRepository;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.booking.domain.model.ReservationStatus;
import personal.salon.core.payment.application.port.out.ReservationConfirmationPort;

/**
 * 결제 완료 시 예약 상태 전이 (PENDING → 전이표의 다음 상태)
 */
@Component
@RequiredArgsConstructor
public class ReservationConfirmationAdapter implements ReservationConfirmationPort {

    private final ReservationRepository reservationRepository;

    @Override
    public boolean confirmSettled(Reservation reservation) {
        return reservationRepository.compareAndSetStatus(
                reservation.id(), ReservationStatus.PENDING, reservation.statusAfterSettlement());
    }
}
