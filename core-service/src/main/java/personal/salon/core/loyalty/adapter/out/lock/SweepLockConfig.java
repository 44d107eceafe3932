package personal.salon.core.loyalty.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.salon.core.loyalty.application.port.out.SweepLockPort;

/**
 * loyalty.sweep-lock.strategy 값에 따라 스윕 락 구현체를 등록한다.
 */
@Slf4j
@Configuration
public class SweepLockConfig {

    private static final String STRATEGY = "loyalty.sweep-lock.strategy";

    @Bean
    @ConditionalOnProperty(name = STRATEGY, havingValue = "local", matchIfMissing = true)
    public SweepLockPort inProcessSweepLock() {
        log.info("Sweep lock: in-process (single instance)");
        return new InProcessSweepLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = STRATEGY, havingValue = "redis")
    public SweepLockPort redisSweepLock(StringRedisTemplate redisTemplate, SweepLockProperties properties) {
        log.info("Sweep lock: redis, ttl={}", properties.getTtl());
        return new RedisSweepLockAdapter(redisTemplate, properties.getTtl(), properties.getKeyPrefix());
    }
}
