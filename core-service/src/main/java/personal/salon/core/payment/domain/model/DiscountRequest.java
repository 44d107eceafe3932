package personal.salon.core.payment.domain.model;

/**
 * 요청된 할인 선택자 (리워드 ID 또는 프로모션 코드, 둘 중 하나만 허용)
 */
public record DiscountRequest(Long rewardId, String promoCode) {

    public DiscountRequest {
        if (promoCode != null) {
            promoCode = promoCode.trim();
            if (promoCode.isEmpty()) {
                promoCode = null;
            }
        }
    }

    public static DiscountRequest none() {
        return new DiscountRequest(null, null);
    }

    public boolean hasReward() {
        return rewardId != null;
    }

    public boolean hasPromo() {
        return promoCode != null;
    }
}
