package personal.salon.core.loyalty.adapter.in.web.dto;

import personal.salon.core.loyalty.domain.model.AvailableReward;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 리워드 응답 DTO
 */
public record RewardResponse(
        Long rewardId,
        BigDecimal discountPercentage,
        String note,
        boolean active,
        LocalDateTime earnedAt,
        LocalDateTime redeemedAt) {

    public static RewardResponse from(AvailableReward reward) {
        return new RewardResponse(
                reward.id(),
                reward.discountPercentage(),
                reward.note(),
                reward.active(),
                reward.createdAt(),
                reward.redeemedAt());
    }
}
