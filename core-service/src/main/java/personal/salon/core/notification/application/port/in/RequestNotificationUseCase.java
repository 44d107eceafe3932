package personal.salon.core.notification.application.port.in;

import personal.salon.core.notification.domain.model.NotificationRequest;

/**
 * 알림 요청 접수
 * 호출자의 트랜잭션과 분리되어 저장되므로 실패해도 호출자의 작업을 되돌리지 않는다.
 */
public interface RequestNotificationUseCase {

    void request(NotificationRequest request);
}
