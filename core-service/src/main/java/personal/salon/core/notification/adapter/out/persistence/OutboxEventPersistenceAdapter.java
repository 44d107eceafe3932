package personal.salon.core.notification.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.core.notification.application.port.out.OutboxEventRepository;
import personal.salon.core.notification.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * OutboxEventRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        OutboxEventEntity entity = OutboxEventEntity.fromDomain(outboxEvent);
        return jpaOutboxEventRepository.save(entity).toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents() {
        return jpaOutboxEventRepository.findByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
                        OutboxEvent.OutboxEventStatus.PENDING,
                        OutboxEvent.MAX_RETRY_COUNT)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
