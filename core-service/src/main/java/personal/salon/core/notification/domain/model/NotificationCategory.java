package personal.salon.core.notification.domain.model;

/**
 * 알림 요청 분류
 */
public enum NotificationCategory {
    /** 적립으로 리워드 발급 */
    REWARD_EARNED,
    /** 단골 고객 프로모션 발급 */
    PROMOTION_ISSUED,
    /** 정산 시 리워드 사용 */
    REWARD_REDEEMED,
    /** 정산 시 프로모션 코드 사용 */
    PROMO_REDEEMED,
    /** 고객에게 예약 확정 안내 */
    BOOKING_CONFIRMED,
    /** 배정된 스태프에게 예약 확정 안내 */
    BOOKING_CONFIRMED_STAFF
}
