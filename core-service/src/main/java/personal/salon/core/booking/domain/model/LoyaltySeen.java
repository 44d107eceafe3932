package personal.salon.core.booking.domain.model;

/**
 * 적립 처리 여부 (Loyalty Accrual Job 전용 플래그)
 */
public enum LoyaltySeen {
    /** 아직 적립 처리되지 않음 */
    UNPROCESSED,
    /** 방문 적립 처리 완료 */
    PROCESSED,
    /** 취소 예약으로 확인 처리 (적립 없음) */
    CANCELED_PROCESSED
}
