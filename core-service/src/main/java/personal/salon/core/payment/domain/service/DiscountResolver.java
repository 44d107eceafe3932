package personal.salon.core.payment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.exception.BothDiscountsRequestedException;
import personal.salon.core.loyalty.domain.exception.PromoExpiredException;
import personal.salon.core.loyalty.domain.exception.PromoNotFoundException;
import personal.salon.core.loyalty.domain.exception.PromoRequiresReservationException;
import personal.salon.core.loyalty.domain.exception.RewardNotEligibleException;
import personal.salon.core.loyalty.domain.model.AvailableReward;
import personal.salon.core.loyalty.domain.model.PromotionStatus;
import personal.salon.core.loyalty.domain.model.UserPromotion;
import personal.salon.core.payment.domain.model.DiscountRequest;
import personal.salon.core.payment.domain.model.ResolvedDiscount;
import personal.salon.core.payment.domain.model.SettlementTarget;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Discount Resolver
 * 요청된 할인 선택자를 검증하고 적용 가능한 할인율로 변환한다.
 * 조회만 수행하며 원장을 변경하지 않는다. 실제 사용 처리는 정산 원자 단위에서 조건부 갱신으로 이루어진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscountResolver {

    private final RewardLedger rewardLedger;
    private final PromotionLedger promotionLedger;
    private final Clock clock;

    public ResolvedDiscount resolve(Long userId, SettlementTarget target, DiscountRequest request) {
        if (request.hasReward() && request.hasPromo()) {
            throw new BothDiscountsRequestedException();
        }
        if (request.hasReward()) {
            return resolveReward(userId, target.merchantId(), request.rewardId());
        }
        if (request.hasPromo()) {
            if (!target.isReservation()) {
                throw new PromoRequiresReservationException();
            }
            return resolvePromo(userId, target.merchantId(), request.promoCode());
        }
        return ResolvedDiscount.none();
    }

    private ResolvedDiscount resolveReward(Long userId, Long merchantId, Long rewardId) {
        AvailableReward reward = rewardLedger.findRedeemable(rewardId, userId, merchantId)
                .filter(AvailableReward::isRedeemable)
                .orElseThrow(() -> {
                    log.warn("Reward not eligible: rewardId={}, userId={}, merchantId={}",
                            rewardId, userId, merchantId);
                    return new RewardNotEligibleException(rewardId);
                });
        return ResolvedDiscount.reward(reward.id(), reward.discountPercentage());
    }

    private ResolvedDiscount resolvePromo(Long userId, Long merchantId, String code) {
        UserPromotion promotion = promotionLedger.findByCode(userId, merchantId, code)
                .filter(found -> found.status() != PromotionStatus.REDEEMED)
                .orElseThrow(() -> {
                    log.warn("Promo code not found: code={}, userId={}, merchantId={}", code, userId, merchantId);
                    return new PromoNotFoundException(code);
                });

        if (promotion.isExpiredAt(LocalDateTime.now(clock))) {
            log.warn("Promo code expired: code={}, userId={}, expiresAt={}", code, userId, promotion.expiresAt());
            throw new PromoExpiredException(code);
        }
        return ResolvedDiscount.promo(promotion.id(), promotion.code(), promotion.discountPercentage());
    }
}
