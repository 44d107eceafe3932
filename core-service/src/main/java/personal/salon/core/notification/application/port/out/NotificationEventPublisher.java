package personal.salon.core.notification.application.port.out;

/**
 * 알림 이벤트 발행 Port (메시지 브로커)
 */
public interface NotificationEventPublisher {

    /**
     * 직렬화된 페이로드를 그대로 발행
     * 브로커 확인(ack)까지 대기하며, 실패하면 예외를 던진다.
     */
    void publishRaw(String key, String payload);
}
