package personal.salon.core.booking.domain.model;

/**
 * 예약 상태를 변경시키는 이벤트
 */
public enum ReservationEvent {
    /** 결제 정산 완료 */
    PAYMENT_SETTLED,
    /** 방문(시술) 완료 */
    VISIT_COMPLETED,
    /** 예약 취소 */
    CANCEL
}
