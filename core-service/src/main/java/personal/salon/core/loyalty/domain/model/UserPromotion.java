package personal.salon.core.loyalty.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * User Promotion Domain Model
 * 매장이 특정 고객에게 발급한 1회용 할인 코드
 */
public record UserPromotion(
        Long id,
        Long userId,
        Long merchantId,
        String code,
        BigDecimal discountPercentage,
        PromotionStatus status,
        LocalDateTime expiresAt,
        LocalDateTime redeemedAt,
        Long reservationId,
        Long paymentId,
        LocalDateTime createdAt) {

    public UserPromotion {
        if (userId == null || merchantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Promotion owner and merchant are required");
        }
        if (code == null || code.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Promotion code is required");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Promotion status cannot be null");
        }
    }

    /**
     * 신규 발급 (ISSUED)
     */
    public static UserPromotion issue(Long userId, Long merchantId, String code,
                                      BigDecimal discountPercentage, LocalDateTime expiresAt,
                                      LocalDateTime now) {
        return new UserPromotion(null, userId, merchantId, code.trim(), discountPercentage,
                PromotionStatus.ISSUED, expiresAt, null, null, null, now);
    }

    /**
     * 사용 시점 만료 판정
     * 저장된 상태가 ISSUED여도 만료 시각이 지났으면 만료로 본다.
     */
    public boolean isExpiredAt(LocalDateTime now) {
        if (status == PromotionStatus.EXPIRED) {
            return true;
        }
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
