package personal.salon.core.payment.domain.model;

/**
 * 예약 해제(보상) 작업 결과
 */
public enum ReleaseOutcome {
    /** PENDING 예약이 삭제됨 */
    RELEASED,
    /** 조건 불일치 (이미 확정/삭제/타인 소유) */
    NOT_RELEASED,
    /** 해제 작업 자체가 실패 (로그만 남김) */
    FAILED
}
