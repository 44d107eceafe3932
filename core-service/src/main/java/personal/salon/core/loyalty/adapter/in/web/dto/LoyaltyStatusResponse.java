package personal.salon.core.loyalty.adapter.in.web.dto;

import personal.salon.core.loyalty.domain.model.LoyaltyStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * 적립 현황 응답 DTO
 */
public record LoyaltyStatusResponse(
        Long merchantId,
        int visitsCount,
        int totalVisitsCount,
        int targetVisits,
        BigDecimal discountPercentage,
        String note,
        List<RewardResponse> rewards) {

    public static LoyaltyStatusResponse from(LoyaltyStatus status) {
        return new LoyaltyStatusResponse(
                status.merchantId(),
                status.visitsCount(),
                status.totalVisitsCount(),
                status.program().targetVisits(),
                status.program().discountPercentage(),
                status.program().note(),
                status.rewards().stream().map(RewardResponse::from).toList());
    }
}
