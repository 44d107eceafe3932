package personal.salon.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Service;
import personal.salon.common.dto.HealthCheckResponse;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.TimeUnit;

/**
 * Health Check 공통 서비스
 * DB(원장), Redis(스케줄러 락), Kafka(알림 브로커) 상태를 확인한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    public static final String UP = "UP";
    public static final String DOWN = "DOWN";

    private static final long KAFKA_TIMEOUT_SECONDS = 5;

    private final StringRedisTemplate redisTemplate;
    private final KafkaAdmin kafkaAdmin;

    /**
     * 전체 인프라 상태
     */
    public HealthCheckResponse checkAll(DataSource dataSource) {
        return new HealthCheckResponse(checkDatabase(dataSource), checkRedis(), checkKafka());
    }

    public String checkRedis() {
        try {
            String response = redisTemplate.execute(RedisConnection::ping, true);
            return "PONG".equals(response) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Redis health check failed", e);
            return DOWN;
        }
    }

    public String checkKafka() {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            var nodes = adminClient.describeCluster().nodes().get(KAFKA_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return (nodes != null && !nodes.isEmpty()) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Kafka health check failed", e);
            return DOWN;
        }
    }

    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(1) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return DOWN;
        }
    }
}
