package personal.salon.core.loyalty.adapter.in.web.dto;

import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.util.List;

public record LoyalCustomerPromotionsResponse(
        int promotionsCreated,
        List<Recipient> recipients) {

    public static LoyalCustomerPromotionsResponse from(List<UserPromotion> issued) {
        return new LoyalCustomerPromotionsResponse(
                issued.size(),
                issued.stream().map(Recipient::from).toList());
    }

    public record Recipient(Long userId, Long promotionId, String promoCode) {

        static Recipient from(UserPromotion promotion) {
            return new Recipient(promotion.userId(), promotion.id(), promotion.code());
        }
    }
}
