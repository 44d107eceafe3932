package personal.salon.core.loyalty.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.salon.common.exception.BusinessException;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UserPromotion 도메인 테스트")
class UserPromotionTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 5, 1, 12, 0);

    @Test
    @DisplayName("만료 시각이 지난 ISSUED 코드는 만료로 판정된다")
    void isExpiredAt_PastExpiry() {
        UserPromotion promotion = UserPromotion.issue(10L, 100L, "SPRING", new BigDecimal("10"),
                NOW.minusMinutes(1), NOW.minusDays(7));

        assertThat(promotion.isExpiredAt(NOW)).isTrue();
    }

    @Test
    @DisplayName("만료 시각이 없으면 만료되지 않는다")
    void isExpiredAt_NoExpiry() {
        UserPromotion promotion = UserPromotion.issue(10L, 100L, " SPRING ", new BigDecimal("10"), null, NOW);

        assertThat(promotion.isExpiredAt(NOW.plusYears(1))).isFalse();
        assertThat(promotion.code()).isEqualTo("SPRING");
    }

    @Test
    @DisplayName("ISSUED에서만 사용/만료 전이가 가능하다")
    void statusTransitions() {
        assertThat(PromotionStatus.ISSUED.next(PromotionEvent.REDEEM)).isEqualTo(PromotionStatus.REDEEMED);
        assertThat(PromotionStatus.ISSUED.next(PromotionEvent.EXPIRE)).isEqualTo(PromotionStatus.EXPIRED);
        assertThatThrownBy(() -> PromotionStatus.REDEEMED.next(PromotionEvent.REDEEM))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> PromotionStatus.EXPIRED.next(PromotionEvent.REDEEM))
                .isInstanceOf(BusinessException.class);
    }
}
