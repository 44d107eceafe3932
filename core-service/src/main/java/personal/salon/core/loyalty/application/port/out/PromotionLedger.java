package personal.salon.core.loyalty.application.port.out;

import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Promotion Ledger (Output Port)
 */
public interface PromotionLedger {

    /**
     * (code, 소유자, 매장) 조건으로 조회 (상태 무관)
     */
    Optional<UserPromotion> findByCode(Long userId, Long merchantId, String code);

    /**
     * 현재 상태가 ISSUED일 때만 REDEEMED로 변경하고 사용 내역을 기록
     *
     * @return 정확히 한 건이 갱신되었으면 true
     */
    boolean redeem(Long promotionId, Long userId, Long merchantId,
                   LocalDateTime redeemedAt, Long reservationId, Long paymentId);

    /**
     * 만료 시각이 지난 ISSUED 코드를 EXPIRED로 일괄 변경
     *
     * @return 변경 건수
     */
    int expireOverdue(LocalDateTime now);

    boolean existsCode(Long userId, Long merchantId, String code);

    /**
     * 매장 안에서 코드 사용 여부 (소유자 무관)
     */
    boolean existsCodeAtMerchant(Long merchantId, String code);

    /**
     * 고객의 전체 프로모션 (상태 무관, 최근 발급 순)
     */
    List<UserPromotion> findAllByOwner(Long userId);

    UserPromotion issue(UserPromotion promotion);
}
