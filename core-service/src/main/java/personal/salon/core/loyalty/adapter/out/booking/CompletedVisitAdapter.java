package personal.salon.core.loyalty.adapter.out.booking;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.core.booking.application.port.out.ReservationRepository;
import personal.salon.core.booking.domain.model.LoyaltySeen;
import personal.salon.core.loyalty.application.port.out.CompletedVisitPort;
import personal.salon.core.loyalty.domain.model.CompletedVisit;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Completed Visit Adapter
 * 예약 저장소를 적립 관점으로 노출하는 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompletedVisitAdapter implements CompletedVisitPort {

    private final ReservationRepository reservationRepository;

    @Override
    public List<CompletedVisit> findUnprocessed(LocalDateTime now) {
        return reservationRepository.findAccrualCandidates(now)
                .stream()
                .map(reservation -> new CompletedVisit(
                        reservation.id(),
                        reservation.customerId(),
                        reservation.merchantId(),
                        reservation.scheduledEnd()))
                .toList();
    }

    @Override
    public boolean markProcessed(Long reservationId) {
        return reservationRepository.markLoyaltySeen(reservationId, LoyaltySeen.UNPROCESSED, LoyaltySeen.PROCESSED);
    }

    @Override
    public int markCanceledProcessed() {
        int marked = reservationRepository.markCanceledAsLoyaltySeen();
        if (marked > 0) {
            log.debug("Canceled reservations marked as loyalty-seen: count={}", marked);
        }
        return marked;
    }
}
