package personal.salon.core.loyalty.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 프로모션 코드 상태와 상태 전이표
 * ISSUED에서만 REDEEMED 또는 EXPIRED로 전이할 수 있다.
 */
public enum PromotionStatus {
    ISSUED,
    REDEEMED,
    EXPIRED;

    public PromotionStatus next(PromotionEvent event) {
        if (this == ISSUED) {
            switch (event) {
                case REDEEM:
                    return REDEEMED;
                case EXPIRE:
                    return EXPIRED;
                default:
                    break;
            }
        }
        throw new BusinessException(ErrorCode.CONFLICT,
                String.format("프로모션 상태 %s에서 %s 이벤트를 처리할 수 없습니다.", this, event));
    }
}
