package personal.salon.core.loyalty.domain.model;

import java.util.List;

/**
 * 고객의 매장별 적립 현황 (조회 전용)
 */
public record LoyaltyStatus(
        Long merchantId,
        int visitsCount,
        int totalVisitsCount,
        LoyaltyProgram program,
        List<AvailableReward> rewards) {
}
