package personal.salon.core.notification.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.salon.core.notification.application.port.out.NotificationEventPublisher;
import personal.salon.core.notification.domain.exception.NotificationPublishException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Notification Kafka Publisher (Adapter Layer)
 * 외부 알림 발송 컴포넌트가 구독하는 토픽으로 이벤트를 전달한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationKafkaPublisher implements NotificationEventPublisher {

    static final String TOPIC_NOTIFICATION_REQUESTED = "notification.requested";
    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publishRaw(String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", TOPIC_NOTIFICATION_REQUESTED, key);
        try {
            kafkaTemplate.send(TOPIC_NOTIFICATION_REQUESTED, key, payload)
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Raw event published: topic={}, key={}", TOPIC_NOTIFICATION_REQUESTED, key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationPublishException("Kafka publish interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new NotificationPublishException("Kafka publish failed", e);
        }
    }
}
