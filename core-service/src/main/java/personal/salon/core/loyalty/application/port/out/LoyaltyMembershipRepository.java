package personal.salon.core.loyalty.application.port.out;

import personal.salon.core.loyalty.domain.model.LoyaltyMembership;

import java.util.List;
import java.util.Optional;

/**
 * Loyalty Membership Repository (Output Port)
 */
public interface LoyaltyMembershipRepository {

    /**
     * 멤버십 행을 배타 잠금(SELECT ... FOR UPDATE)으로 조회
     * 트랜잭션 안에서만 호출해야 한다.
     */
    Optional<LoyaltyMembership> findForUpdate(Long userId, Long merchantId);

    Optional<LoyaltyMembership> find(Long userId, Long merchantId);

    /**
     * 누적 방문 수가 기준 이상인 매장 멤버십 (userId 오름차순)
     */
    List<LoyaltyMembership> findWithMinimumTotalVisits(Long merchantId, int minimumTotalVisits);

    LoyaltyMembership create(LoyaltyMembership membership);

    LoyaltyMembership save(LoyaltyMembership membership);
}
