package personal.salon.core.notification.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.salon.core.notification.application.port.in.PublishPendingNotificationsUseCase;

/**
 * Outbox Event Scheduler (Driving Adapter)
 * 주기적으로 PENDING 상태의 알림 이벤트를 발행
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventScheduler {

    private final PublishPendingNotificationsUseCase publishPendingNotificationsUseCase;

    /**
     * 이전 작업 완료 후 notification.outbox.interval-ms 마다 실행 (기본 500ms)
     */
    @Scheduled(fixedDelayString = "${notification.outbox.interval-ms:500}")
    public void schedulePublishing() {
        try {
            int publishedCount = publishPendingNotificationsUseCase.publishPendingNotifications();
            if (publishedCount > 0) {
                log.debug("Scheduled notification publishing completed. Count: {}", publishedCount);
            }
        } catch (Exception e) {
            log.error("Notification outbox relay failed", e);
        }
    }
}
