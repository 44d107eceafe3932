package personal.salon.core.payment.adapter.in.web.dto;

import personal.salon.core.payment.application.port.in.PreviewPromoCodeCommand;

import java.math.BigDecimal;

/**
 * 프로모션 코드 미리보기 요청 DTO
 * 필수 값 검증은 인증 확인 이후 서비스에서 수행한다.
 */
public record PromoPreviewRequest(
        Long reservationId,
        String promoCode,
        BigDecimal amount) {

    public PreviewPromoCodeCommand toCommand(Long userId) {
        return new PreviewPromoCodeCommand(userId, reservationId, promoCode, amount);
    }
}
