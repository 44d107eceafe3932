package personal.salon.core.notification.domain.exception;

/**
 * 알림 이벤트를 메시지 브로커로 전달하지 못했을 때 발생
 * 아웃박스 재시도 대상이며 API 응답으로 노출되지 않는다.
 */
public class NotificationPublishException extends RuntimeException {
    public NotificationPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
