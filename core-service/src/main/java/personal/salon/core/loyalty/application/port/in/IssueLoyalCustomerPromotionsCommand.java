package personal.salon.core.loyalty.application.port.in;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * @param expiresAt 만료 시각 (없으면 무기한)
 */
public record IssueLoyalCustomerPromotionsCommand(
        Long merchantId,
        BigDecimal discountPercentage,
        LocalDateTime expiresAt) {
}
