package personal.salon.core.loyalty.adapter.in.web.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.salon.core.loyalty.application.port.in.IssuePromotionCommand;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 프로모션 발급 요청 DTO
 */
public record IssuePromotionRequest(
        @NotNull(message = "userId는 필수입니다.")
        Long userId,

        @NotBlank(message = "promoCode는 필수입니다.")
        @Size(max = 50, message = "promoCode는 50자 이하여야 합니다.")
        String promoCode,

        @NotNull(message = "discountPercentage는 필수입니다.")
        @DecimalMin(value = "0", inclusive = false, message = "할인율은 0보다 커야 합니다.")
        @DecimalMax(value = "100", message = "할인율은 100 이하여야 합니다.")
        BigDecimal discountPercentage,

        LocalDateTime expiresAt) {

    public IssuePromotionCommand toCommand(Long merchantId) {
        return new IssuePromotionCommand(merchantId, userId, promoCode, discountPercentage, expiresAt);
    }
}
