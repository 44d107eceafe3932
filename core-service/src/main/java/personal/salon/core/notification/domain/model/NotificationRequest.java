package personal.salon.core.notification.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * Notification Request
 * 외부 발송 컴포넌트로 전달되는 알림 요청 (수신자, 분류, 메시지)
 *
 * @param reservationId 관련 예약 (없으면 null)
 * @param paymentId     관련 결제 (없으면 null)
 */
public record NotificationRequest(
        Long recipientUserId,
        NotificationCategory category,
        String message,
        Long merchantId,
        Long reservationId,
        Long paymentId) {

    public NotificationRequest {
        if (recipientUserId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification recipient is required");
        }
        if (category == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification category is required");
        }
        if (message == null || message.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification message is required");
        }
    }
}
