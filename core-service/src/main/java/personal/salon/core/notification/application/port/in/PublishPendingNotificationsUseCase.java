package personal.salon.core.notification.application.port.in;

/**
 * 대기 중인 알림 이벤트 발행
 */
public interface PublishPendingNotificationsUseCase {

    /**
     * @return 발행에 성공한 이벤트 수
     */
    int publishPendingNotifications();
}
