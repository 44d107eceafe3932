package personal.salon.core.loyalty.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.domain.model.PromotionEvent;
import personal.salon.core.loyalty.domain.model.PromotionStatus;
import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Promotion Ledger Persistence Adapter
 * 상태 전이 대상은 PromotionStatus 전이표에서 가져온다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromotionLedgerAdapter implements PromotionLedger {

    private final JpaUserPromotionRepository jpaUserPromotionRepository;

    @Override
    public Optional<UserPromotion> findByCode(Long userId, Long merchantId, String code) {
        log.debug("Finding promotion: userId={}, merchantId={}", userId, merchantId);
        return jpaUserPromotionRepository.findByUserIdAndMerchantIdAndCode(userId, merchantId, code)
                .map(UserPromotionEntity::toDomain);
    }

    @Override
    public boolean redeem(Long promotionId, Long userId, Long merchantId,
                          LocalDateTime redeemedAt, Long reservationId, Long paymentId) {
        int updated = jpaUserPromotionRepository.redeemIfIssued(
                promotionId, userId, merchantId, redeemedAt, reservationId, paymentId,
                PromotionStatus.ISSUED, PromotionStatus.ISSUED.next(PromotionEvent.REDEEM));
        log.debug("Promotion redeem CAS: promotionId={}, updated={}", promotionId, updated);
        return updated == 1;
    }

    @Override
    public int expireOverdue(LocalDateTime now) {
        return jpaUserPromotionRepository.expireOverdue(
                now, PromotionStatus.ISSUED, PromotionStatus.ISSUED.next(PromotionEvent.EXPIRE));
    }

    @Override
    public boolean existsCode(Long userId, Long merchantId, String code) {
        return jpaUserPromotionRepository.existsByUserIdAndMerchantIdAndCode(userId, merchantId, code);
    }

    @Override
    public boolean existsCodeAtMerchant(Long merchantId, String code) {
        return jpaUserPromotionRepository.existsByMerchantIdAndCode(merchantId, code);
    }

    @Override
    public List<UserPromotion> findAllByOwner(Long userId) {
        return jpaUserPromotionRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                .map(UserPromotionEntity::toDomain)
                .toList();
    }

    @Override
    public UserPromotion issue(UserPromotion promotion) {
        return jpaUserPromotionRepository.saveAndFlush(UserPromotionEntity.fromDomain(promotion)).toDomain();
    }
}
