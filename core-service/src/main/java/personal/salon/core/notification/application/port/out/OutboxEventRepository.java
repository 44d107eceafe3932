package personal.salon.core.notification.application.port.out;

import personal.salon.core.notification.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기 중인 이벤트 조회 (생성 순)
     */
    List<OutboxEvent> findPendingEvents();
}
