package personal.salon.core.loyalty.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 스윕 락 설정
 *
 * loyalty:
 *   sweep-lock:
 *     strategy: redis # local | redis
 *     ttl: 5m
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "loyalty.sweep-lock")
public class SweepLockProperties {

    private Strategy strategy = Strategy.LOCAL;

    /**
     * 락 보유 한도. 적립 스윕 최대 실행 시간보다 길어야 한다.
     */
    private Duration ttl = Duration.ofMinutes(5);

    private String keyPrefix = "salon:sweep-lock:";

    public enum Strategy {
        LOCAL,
        REDIS
    }
}
