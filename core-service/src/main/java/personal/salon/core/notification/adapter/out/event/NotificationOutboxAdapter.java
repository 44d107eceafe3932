package personal.salon.core.notification.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.core.notification.adapter.out.persistence.JpaOutboxEventRepository;
import personal.salon.core.notification.adapter.out.persistence.OutboxEventEntity;
import personal.salon.core.notification.adapter.out.persistence.OutboxEventFactory;
import personal.salon.core.notification.application.port.out.NotificationOutboxPort;
import personal.salon.core.notification.domain.model.NotificationRequest;

/**
 * Notification Outbox Adapter
 * 알림 요청을 별도 트랜잭션으로 아웃박스에 저장한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationOutboxAdapter implements NotificationOutboxPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void enqueue(NotificationRequest request) {
        OutboxEventEntity outboxEvent = outboxEventFactory.createNotificationRequestedEvent(request);
        OutboxEventEntity saved = jpaOutboxEventRepository.save(outboxEvent);
        log.debug("Notification queued: outboxId={}, recipient={}, category={}",
                saved.getId(), request.recipientUserId(), request.category());
    }
}
