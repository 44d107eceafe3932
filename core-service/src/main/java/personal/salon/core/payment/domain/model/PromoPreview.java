package personal.salon.core.payment.domain.model;

import java.math.BigDecimal;

/**
 * 프로모션 코드 적용 시 예상 결제 금액
 */
public record PromoPreview(
        Long promotionId,
        String promoCode,
        BigDecimal discountPercentage,
        BigDecimal originalAmount,
        BigDecimal discountAmount,
        BigDecimal discountedAmount) {

    public static PromoPreview of(ResolvedDiscount discount, PaymentAmount original, PaymentAmount discounted) {
        return new PromoPreview(
                discount.sourceId(),
                discount.promoCode(),
                discount.percentage(),
                original.value(),
                original.value().subtract(discounted.value()),
                discounted.value());
    }
}
