package personal.salon.core.notification.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.notification.domain.model.NotificationRequest;

/**
 * Outbox Event Factory (Adapter Layer)
 * NotificationRequest를 OutboxEventEntity로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    static final String AGGREGATE_TYPE = "NOTIFICATION";

    private final ObjectMapper objectMapper;

    public OutboxEventEntity createNotificationRequestedEvent(NotificationRequest request) {
        try {
            NotificationRequestedEvent event = new NotificationRequestedEvent(
                    request.recipientUserId(),
                    request.category().name(),
                    request.message(),
                    request.merchantId(),
                    request.reservationId(),
                    request.paymentId());

            String payload = objectMapper.writeValueAsString(event);

            return OutboxEventEntity.create(
                    AGGREGATE_TYPE,
                    request.recipientUserId(),
                    request.category().name(),
                    payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: recipient={}, category={}",
                    request.recipientUserId(), request.category(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event", e);
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record NotificationRequestedEvent(
            Long recipientUserId,
            String category,
            String message,
            Long merchantId,
            Long reservationId,
            Long paymentId) {
    }
}
