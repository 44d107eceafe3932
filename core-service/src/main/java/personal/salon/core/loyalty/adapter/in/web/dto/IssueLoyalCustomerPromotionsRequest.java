package personal.salon.core.loyalty.adapter.in.web.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import personal.salon.core.loyalty.application.port.in.IssueLoyalCustomerPromotionsCommand;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 단골 고객 일괄 발급 요청 DTO
 */
public record IssueLoyalCustomerPromotionsRequest(
        @NotNull(message = "discountPercentage는 필수입니다.")
        @DecimalMin(value = "0", inclusive = false, message = "할인율은 0보다 커야 합니다.")
        @DecimalMax(value = "100", message = "할인율은 100 이하여야 합니다.")
        BigDecimal discountPercentage,

        LocalDateTime expiresAt) {

    public IssueLoyalCustomerPromotionsCommand toCommand(Long merchantId) {
        return new IssueLoyalCustomerPromotionsCommand(merchantId, discountPercentage, expiresAt);
    }
}
