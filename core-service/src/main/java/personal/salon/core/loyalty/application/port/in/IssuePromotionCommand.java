package personal.salon.core.loyalty.application.port.in;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 프로모션 발급 Command
 */
public record IssuePromotionCommand(
        Long merchantId,
        Long userId,
        String code,
        BigDecimal discountPercentage,
        LocalDateTime expiresAt) {
}
