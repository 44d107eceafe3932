package personal.salon.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.core.booking.application.port.out.ReservationRepository;
import personal.salon.core.booking.domain.model.LoyaltySeen;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reservation Persistence Adapter
 * JPQL 조건부 갱신의 영향 행 수를 boolean으로 변환한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private final JpaReservationRepository jpaReservationRepository;

    @Override
    public Optional<Reservation> findById(Long reservationId) {
        log.debug("Finding reservation: reservationId={}", reservationId);
        return jpaReservationRepository.findById(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public boolean compareAndSetStatus(Long reservationId, ReservationStatus expected, ReservationStatus next) {
        int updated = jpaReservationRepository.updateStatusIfMatches(reservationId, expected, next);
        log.debug("Reservation status CAS: reservationId={}, {} -> {}, updated={}",
                reservationId, expected, next, updated);
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean deletePendingOwnedBy(Long reservationId, Long customerId) {
        return jpaReservationRepository.findForDelete(reservationId, customerId, ReservationStatus.PENDING)
                .map(entity -> {
                    jpaReservationRepository.delete(entity);
                    jpaReservationRepository.flush();
                    log.debug("Pending reservation deleted: reservationId={}", reservationId);
                    return true;
                })
                .orElse(false);
    }

    @Override
    public List<Reservation> findAccrualCandidates(LocalDateTime now) {
        return jpaReservationRepository.findAccrualCandidates(
                        ReservationStatus.COMPLETED, LoyaltySeen.UNPROCESSED, now)
                .stream()
                .map(ReservationEntity::toDomain)
                .toList();
    }

    @Override
    public boolean markLoyaltySeen(Long reservationId, LoyaltySeen expected, LoyaltySeen next) {
        return jpaReservationRepository.updateLoyaltySeenIfMatches(reservationId, expected, next) == 1;
    }

    @Override
    @Transactional
    public int markCanceledAsLoyaltySeen() {
        return jpaReservationRepository.updateLoyaltySeenByStatus(
                ReservationStatus.CANCELED, LoyaltySeen.UNPROCESSED, LoyaltySeen.CANCELED_PROCESSED);
    }
}
