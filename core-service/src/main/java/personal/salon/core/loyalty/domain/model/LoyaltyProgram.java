package personal.salon.core.loyalty.domain.model;

import java.math.BigDecimal;

/**
 * 매장별 적립 프로그램 설정 (읽기 전용)
 *
 * @param targetVisits       리워드 발급에 필요한 방문 횟수
 * @param discountPercentage 발급 리워드의 할인율
 */
public record LoyaltyProgram(
        Long id,
        Long merchantId,
        int targetVisits,
        BigDecimal discountPercentage,
        boolean active,
        String note) {

    public boolean canMint() {
        return active && targetVisits > 0;
    }
}
