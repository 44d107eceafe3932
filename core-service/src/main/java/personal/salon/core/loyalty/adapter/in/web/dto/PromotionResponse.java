package personal.salon.core.loyalty.adapter.in.web.dto;

import personal.salon.core.loyalty.domain.model.PromotionStatus;
import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PromotionResponse(
        Long promotionId,
        Long merchantId,
        Long userId,
        String promoCode,
        BigDecimal discountPercentage,
        PromotionStatus status,
        LocalDateTime expiresAt) {

    public static PromotionResponse from(UserPromotion promotion) {
        return new PromotionResponse(
                promotion.id(),
                promotion.merchantId(),
                promotion.userId(),
                promotion.code(),
                promotion.discountPercentage(),
                promotion.status(),
                promotion.expiresAt());
    }
}
