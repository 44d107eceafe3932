package personal.salon.core.notification.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model (불변)
 * 발행 대기 중인 알림 요청 이벤트
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount) {

    public static final int MAX_RETRY_COUNT = 3;

    public OutboxEvent markAsPublished(LocalDateTime now) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, now, retryCount);
    }

    /**
     * 재시도 횟수 증가. 최대 횟수에 도달하면 FAILED로 전환한다.
     */
    public OutboxEvent recordFailure() {
        int retried = retryCount + 1;
        OutboxEventStatus next = retried >= MAX_RETRY_COUNT ? OutboxEventStatus.FAILED : status;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                next, createdAt, publishedAt, retried);
    }

    public enum OutboxEventStatus {
        PENDING,    // 발행 대기
        PUBLISHED,  // 발행 완료
        FAILED      // 발행 실패
    }
}
