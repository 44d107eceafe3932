package personal.salon.core.notification.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.core.notification.application.port.in.RequestNotificationUseCase;
import personal.salon.core.notification.application.port.out.NotificationOutboxPort;
import personal.salon.core.notification.domain.model.NotificationRequest;

/**
 * Notification Request Service
 * 알림 요청을 아웃박스에 위임한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationRequestService implements RequestNotificationUseCase {

    private final NotificationOutboxPort notificationOutboxPort;

    @Override
    public void request(NotificationRequest request) {
        log.debug("Notification requested: recipient={}, category={}",
                request.recipientUserId(), request.category());
        notificationOutboxPort.enqueue(request);
    }
}
