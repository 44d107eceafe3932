package personal.salon.core.booking.application.port.out;

import personal.salon.core.booking.domain.model.LoyaltySeen;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reservation Repository (Output Port)
 * 상태 변경은 모두 조건부 갱신(compare-and-set)으로만 수행하며 성공 여부를 boolean으로 반환한다.
 */
public interface ReservationRepository {

    Optional<Reservation> findById(Long reservationId);

    /**
     * 현재 상태가 expected일 때만 next로 변경
     *
     * @return 정확히 한 건이 변경되었으면 true
     */
    boolean compareAndSetStatus(Long reservationId, ReservationStatus expected, ReservationStatus next);

    /**
     * (id, 소유자, PENDING) 조건을 모두 만족하는 예약만 삭제
     *
     * @return 삭제되었으면 true
     */
    boolean deletePendingOwnedBy(Long reservationId, Long customerId);

    /**
     * 적립 대상 예약 조회: COMPLETED, 미처리, 종료 시각이 now 이전
     */
    List<Reservation> findAccrualCandidates(LocalDateTime now);

    /**
     * 적립 처리 플래그 조건부 변경
     */
    boolean markLoyaltySeen(Long reservationId, LoyaltySeen expected, LoyaltySeen next);

    /**
     * 미처리 상태의 CANCELED 예약을 모두 CANCELED_PROCESSED로 변경
     *
     * @return 변경된 건수
     */
    int markCanceledAsLoyaltySeen();
}
