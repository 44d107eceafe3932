package personal.salon.core.loyalty.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.salon.core.loyalty.application.port.out.SweepLockPort;
import personal.salon.core.loyalty.domain.model.Sweep;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 단일 인스턴스용 스윕 락
 * 수동 실행과 타이머 실행이 겹치지 않도록 JVM 안에서만 배제한다.
 */
@Slf4j
public class InProcessSweepLockAdapter implements SweepLockPort {

    private final Set<Sweep> running = ConcurrentHashMap.newKeySet();

    @Override
    public boolean tryAcquire(Sweep sweep) {
        boolean acquired = running.add(sweep);
        if (!acquired) {
            log.debug("Sweep already running in this instance: sweep={}", sweep.key());
        }
        return acquired;
    }

    @Override
    public void release(Sweep sweep) {
        running.remove(sweep);
    }
}
