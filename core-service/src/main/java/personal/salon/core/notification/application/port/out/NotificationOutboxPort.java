package personal.salon.core.notification.application.port.out;

import personal.salon.core.notification.domain.model.NotificationRequest;

/**
 * 알림 요청을 아웃박스에 기록하는 Port
 */
public interface NotificationOutboxPort {

    void enqueue(NotificationRequest request);
}
