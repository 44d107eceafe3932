package personal.salon.core.loyalty.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Available Reward Domain Model
 * 적립으로 발급된 1회용 할인 리워드
 * active=true, redeemedAt=null 상태에서 정확히 한 번만 사용된다.
 */
public record AvailableReward(
        Long id,
        Long userId,
        Long merchantId,
        BigDecimal discountPercentage,
        String note,
        boolean active,
        LocalDateTime redeemedAt,
        LocalDateTime createdAt) {

    public AvailableReward {
        if (userId == null || merchantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reward owner and merchant are required");
        }
        if (discountPercentage == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reward discount percentage is required");
        }
    }

    /**
     * 적립 프로그램 기준으로 새 리워드 발급
     */
    public static AvailableReward mint(Long userId, LoyaltyProgram program, LocalDateTime now) {
        return new AvailableReward(
                null,
                userId,
                program.merchantId(),
                program.discountPercentage(),
                program.note(),
                true,
                null,
                now);
    }

    public boolean isRedeemable() {
        return active && redeemedAt == null;
    }
}
