package personal.salon.core.booking.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.booking.domain.exception.ReservationAccessDeniedException;
import personal.salon.core.booking.domain.exception.ReservationNotPendingException;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변). 예약 생성은 외부 컴포넌트가 담당한다.
 */
public record Reservation(
        Long id,
        Long customerId,
        Long merchantId,
        LocalDateTime scheduledStart,
        LocalDateTime scheduledEnd,
        ReservationStatus status,
        LoyaltySeen loyaltySeen,
        Set<Long> staffUserIds,
        LocalDateTime createdAt) {

    public Reservation {
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (merchantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Merchant ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation status cannot be null");
        }
        if (loyaltySeen == null) {
            loyaltySeen = LoyaltySeen.UNPROCESSED;
        }
        staffUserIds = staffUserIds == null ? Set.of() : Set.copyOf(staffUserIds);
    }

    public boolean isPending() {
        return status == ReservationStatus.PENDING;
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 소유권 검증
     *
     * @param requestUserId 요청 사용자 ID
     * @throws ReservationAccessDeniedException 소유권 불일치 시
     */
    public void ensureOwnership(Long requestUserId) {
        if (!this.customerId.equals(requestUserId)) {
            throw new ReservationAccessDeniedException(id);
        }
    }

    /**
     * PENDING 상태 검증
     *
     * @throws ReservationNotPendingException PENDING 상태가 아닐 때 (현재 상태를 메시지에 포함)
     */
    public void ensurePending() {
        if (!isPending()) {
            throw new ReservationNotPendingException(status);
        }
    }

    /**
     * 결제 정산 시 전이될 상태
     */
    public ReservationStatus statusAfterSettlement() {
        return status.next(ReservationEvent.PAYMENT_SETTLED);
    }
}
