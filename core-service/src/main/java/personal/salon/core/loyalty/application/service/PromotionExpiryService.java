package personal.salon.core.loyalty.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.core.loyalty.application.port.in.ExpirePromotionsUseCase;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 만료 시각이 지난 프로모션 코드를 EXPIRED로 정리한다.
 * 사용 시점 만료 판정은 DiscountResolver가 별도로 수행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionExpiryService implements ExpirePromotionsUseCase {

    private final PromotionLedger promotionLedger;
    private final Clock clock;

    @Override
    @Transactional
    public int expireOverduePromotions() {
        int expired = promotionLedger.expireOverdue(LocalDateTime.now(clock));
        if (expired > 0) {
            log.info("Expired overdue promotions: count={}", expired);
        }
        return expired;
    }
}
