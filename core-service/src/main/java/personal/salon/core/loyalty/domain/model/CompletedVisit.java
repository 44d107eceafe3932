package personal.salon.core.loyalty.domain.model;

import java.time.LocalDateTime;

/**
 * 적립 대상 방문 (COMPLETED 예약의 적립 관점 뷰)
 */
public record CompletedVisit(
        Long reservationId,
        Long customerId,
        Long merchantId,
        LocalDateTime scheduledEnd) {
}
