package personal.salon.core.loyalty.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import personal.salon.core.loyalty.application.port.out.SweepLockPort;
import personal.salon.core.loyalty.domain.model.Sweep;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis Sweep Lock Adapter
 * 스윕 이름 하나당 키 하나. 획득할 때마다 새 토큰을 값으로 쓰고, 해제는 토큰이 일치할 때만 삭제한다.
 * 프로세스가 죽으면 TTL 경과 후 다른 인스턴스가 이어받는다.
 */
@Slf4j
public class RedisSweepLockAdapter implements SweepLockPort {

    static final RedisScript<Long> RELEASE_IF_OWNER = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;
    private final String keyPrefix;

    // 이 인스턴스가 현재 보유한 스윕별 토큰
    private final Map<Sweep, String> heldTokens = new ConcurrentHashMap<>();

    public RedisSweepLockAdapter(StringRedisTemplate redisTemplate, Duration ttl, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public boolean tryAcquire(Sweep sweep) {
        String key = lockKey(sweep);
        String token = UUID.randomUUID().toString();

        try {
            boolean acquired = Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, token, ttl));
            if (acquired) {
                heldTokens.put(sweep, token);
                log.debug("Sweep lock acquired: key={}", key);
            } else {
                log.debug("Sweep lock held by another instance: key={}", key);
            }
            return acquired;
        } catch (RuntimeException e) {
            // 락 저장소를 확인할 수 없으면 이번 주기는 건너뛴다
            log.error("Failed to acquire sweep lock: key={}", key, e);
            return false;
        }
    }

    @Override
    public void release(Sweep sweep) {
        String token = heldTokens.remove(sweep);
        if (token == null) {
            return;
        }

        String key = lockKey(sweep);
        try {
            Long deleted = redisTemplate.execute(RELEASE_IF_OWNER, List.of(key), token);
            if (deleted == null || deleted == 0L) {
                log.warn("Sweep lock expired before release, now owned elsewhere or gone: key={}", key);
            }
        } catch (RuntimeException e) {
            log.error("Failed to release sweep lock, it will expire after {}: key={}", ttl, key, e);
        }
    }

    String lockKey(Sweep sweep) {
        return keyPrefix + sweep.key();
    }
}
