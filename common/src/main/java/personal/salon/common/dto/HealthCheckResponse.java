package personal.salon.common.dto;

/**
 * Health Check 응답 데이터
 *
 * @param database 데이터베이스 상태 ("UP" 또는 "DOWN")
 * @param redis    Redis 상태 (스케줄러 락 저장소)
 * @param kafka    Kafka 상태 (알림 이벤트 브로커)
 */
public record HealthCheckResponse(
        String database,
        String redis,
        String kafka
) {
    public boolean allUp() {
        return "UP".equals(database) && "UP".equals(redis) && "UP".equals(kafka);
    }
}
