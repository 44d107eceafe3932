package personal.salon.core.payment.domain.model;

import java.math.BigDecimal;

/**
 * DiscountResolver 결과
 *
 * @param sourceId  REWARD면 rewardId, PROMO면 promotionId
 * @param promoCode PROMO일 때 코드
 */
public record ResolvedDiscount(
        DiscountKind kind,
        BigDecimal percentage,
        Long sourceId,
        String promoCode) {

    private static final ResolvedDiscount NONE = new ResolvedDiscount(DiscountKind.NONE, null, null, null);

    public static ResolvedDiscount none() {
        return NONE;
    }

    public static ResolvedDiscount reward(Long rewardId, BigDecimal percentage) {
        return new ResolvedDiscount(DiscountKind.REWARD, percentage, rewardId, null);
    }

    public static ResolvedDiscount promo(Long promotionId, String code, BigDecimal percentage) {
        return new ResolvedDiscount(DiscountKind.PROMO, percentage, promotionId, code);
    }

    public boolean isApplied() {
        return kind != DiscountKind.NONE;
    }
}
