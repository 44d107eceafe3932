package personal.salon.core.loyalty.application.port.out;

import personal.salon.core.loyalty.domain.model.Sweep;

/**
 * Sweep Lock (Output Port)
 * 같은 스윕이 여러 곳에서 겹쳐 실행되지 않도록 한다.
 *
 * 구현체:
 * - InProcessSweepLockAdapter: 단일 인스턴스 안에서만 배제 (기본값)
 * - RedisSweepLockAdapter: Redis SET NX 기반 인스턴스 간 배제
 */
public interface SweepLockPort {

    /**
     * @return true면 이번 실행이 스윕을 소유한다. false면 건너뛴다.
     */
    boolean tryAcquire(Sweep sweep);

    /**
     * 본인이 획득한 락만 해제한다. 소유하지 않은 락은 무시한다.
     */
    void release(Sweep sweep);
}
