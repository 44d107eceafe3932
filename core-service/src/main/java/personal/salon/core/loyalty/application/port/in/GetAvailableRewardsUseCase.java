package personal.salon.core.loyalty.application.port.in;

import personal.salon.core.loyalty.domain.model.AvailableReward;

import java.util.List;

public interface GetAvailableRewardsUseCase {

    /**
     * 고객이 매장에서 사용할 수 있는 리워드 목록
     */
    List<AvailableReward> getAvailableRewards(Long userId, Long merchantId);
}
