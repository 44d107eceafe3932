package personal.salon.core.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.salon.core.booking.domain.model.LoyaltySeen;
import personal.salon.core.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Reservation
 */
public interface JpaReservationRepository extends JpaRepository<ReservationEntity, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ReservationEntity r SET r.status = :next WHERE r.id = :id AND r.status = :expected")
    int updateStatusIfMatches(@Param("id") Long id,
                              @Param("expected") ReservationStatus expected,
                              @Param("next") ReservationStatus next);

    /**
     * 삭제 대상 행을 잠금 조회 (id, 소유자, 상태가 모두 일치할 때만)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ReservationEntity r WHERE r.id = :id AND r.userId = :userId AND r.status = :status")
    Optional<ReservationEntity> findForDelete(@Param("id") Long id,
                                              @Param("userId") Long userId,
                                              @Param("status") ReservationStatus status);

    @Query("SELECT r FROM ReservationEntity r "
            + "WHERE r.status = :status AND r.loyaltySeen = :seen AND r.scheduledEnd < :now "
            + "ORDER BY r.scheduledEnd ASC")
    List<ReservationEntity> findAccrualCandidates(@Param("status") ReservationStatus status,
                                                  @Param("seen") LoyaltySeen seen,
                                                  @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ReservationEntity r SET r.loyaltySeen = :next WHERE r.id = :id AND r.loyaltySeen = :expected")
    int updateLoyaltySeenIfMatches(@Param("id") Long id,
                                   @Param("expected") LoyaltySeen expected,
                                   @Param("next") LoyaltySeen next);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ReservationEntity r SET r.loyaltySeen = :next "
            + "WHERE r.status = :status AND r.loyaltySeen = :expected")
    int updateLoyaltySeenByStatus(@Param("status") ReservationStatus status,
                                  @Param("expected") LoyaltySeen expected,
                                  @Param("next") LoyaltySeen next);
}
