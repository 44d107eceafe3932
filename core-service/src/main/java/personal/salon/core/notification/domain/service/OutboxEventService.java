package personal.salon.core.notification.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.core.notification.application.port.in.PublishPendingNotificationsUseCase;
import personal.salon.core.notification.application.port.out.NotificationEventPublisher;
import personal.salon.core.notification.application.port.out.OutboxEventRepository;
import personal.salon.core.notification.domain.model.OutboxEvent;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 알림 이벤트를 발행 처리하는 도메인 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingNotificationsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final NotificationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public int publishPendingNotifications() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents();
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                // Key: 수신자 ID (수신자별 순서 보장)
                String key = String.valueOf(event.aggregateId());

                log.debug("Publishing notification event: id={}, type={}", event.id(), event.eventType());
                eventPublisher.publishRaw(key, event.payload());

                outboxEventRepository.save(event.markAsPublished(LocalDateTime.now(clock)));
                publishedCount++;

            } catch (Exception e) {
                log.error("Failed to publish notification event: id={}, retryCount={}",
                        event.id(), event.retryCount(), e);

                OutboxEvent retried = event.recordFailure();
                if (retried.status() == OutboxEvent.OutboxEventStatus.FAILED) {
                    log.warn("Notification event moved to FAILED: id={}", event.id());
                }
                outboxEventRepository.save(retried);
            }
        }
        return publishedCount;
    }
}
