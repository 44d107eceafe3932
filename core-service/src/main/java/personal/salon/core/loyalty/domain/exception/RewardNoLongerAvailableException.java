package personal.salon.core.loyalty.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 정산 중 리워드 조건부 사용 처리가 실패한 경우 (동시 사용 경합에서 패배)
 */
public class RewardNoLongerAvailableException extends BusinessException {
    public RewardNoLongerAvailableException(Long rewardId) {
        super(ErrorCode.REWARD_NO_LONGER_AVAILABLE, String.format("Reward is no longer available: rewardId=%d", rewardId));
    }
}
