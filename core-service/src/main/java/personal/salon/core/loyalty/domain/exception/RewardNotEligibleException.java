package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 리워드가 없거나, 다른 고객/매장 소유이거나, 이미 사용된 경우
 */
public class RewardNotEligibleException extends BusinessException {
    public RewardNotEligibleException(Long rewardId) {
        super(ErrorCode.REWARD_NOT_ELIGIBLE, String.format("Reward not found or not eligible: rewardId=%d", rewardId));
    }
}
