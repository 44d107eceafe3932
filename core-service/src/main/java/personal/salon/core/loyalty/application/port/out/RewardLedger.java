package personal.salon.core.loyalty.application.port.out;

import personal.salon.core.loyalty.domain.model.AvailableReward;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reward Ledger (Output Port)
 * 리워드 조회 및 조건부 사용 처리. 오케스트레이션 로직은 갖지 않는다.
 */
public interface RewardLedger {

    /**
     * (rewardId, 소유자, 매장, active, 미사용) 조건으로 조회
     */
    Optional<AvailableReward> findRedeemable(Long rewardId, Long userId, Long merchantId);

    /**
     * 소유권 + 활성 + 미사용 조건을 만족할 때만 사용 처리
     *
     * @return 정확히 한 건이 갱신되었으면 true (false면 경합 패배)
     */
    boolean redeem(Long rewardId, Long userId, Long merchantId, LocalDateTime redeemedAt);

    AvailableReward mint(AvailableReward reward);

    List<AvailableReward> findRedeemableByOwner(Long userId, Long merchantId);

    List<AvailableReward> findAllByOwner(Long userId, Long merchantId);
}
