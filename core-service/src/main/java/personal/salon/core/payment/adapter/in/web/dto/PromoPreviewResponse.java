package personal.salon.core.payment.adapter.in.web.dto;

import personal.salon.core.payment.domain.model.PromoPreview;

import java.math.BigDecimal;

public record PromoPreviewResponse(
        Long promotionId,
        String promoCode,
        Pricing pricing) {

    public static PromoPreviewResponse from(PromoPreview preview) {
        return new PromoPreviewResponse(
                preview.promotionId(),
                preview.promoCode(),
                new Pricing(preview.originalAmount(), preview.discountPercentage(),
                        preview.discountAmount(), preview.discountedAmount()));
    }

    public record Pricing(
            BigDecimal originalTotal,
            BigDecimal discountPercentage,
            BigDecimal discountAmount,
            BigDecimal discountedTotal) {
    }
}
