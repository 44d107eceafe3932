package personal.salon.core.loyalty.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * Loyalty Membership Domain Model
 * (고객, 매장) 쌍의 방문 적립 현황
 *
 * @param visitsCount      현재 주기의 방문 수 (리워드 발급 시 목표치만큼 차감)
 * @param totalVisitsCount 누적 방문 수
 */
public record LoyaltyMembership(
        Long id,
        Long userId,
        Long merchantId,
        int visitsCount,
        int totalVisitsCount) {

    public LoyaltyMembership {
        if (userId == null || merchantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Membership owner and merchant are required");
        }
        if (visitsCount < 0 || totalVisitsCount < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Visit counts cannot be negative");
        }
    }

    /**
     * 첫 방문 완료 시 지연 생성되는 멤버십
     */
    public static LoyaltyMembership start(Long userId, Long merchantId) {
        return new LoyaltyMembership(null, userId, merchantId, 0, 0);
    }

    /**
     * 방문 1회 적립
     * 목표 방문 수에 도달하면 초과분을 남기고 차감한 뒤 리워드 발급을 표시한다.
     *
     * @param program 매장의 활성 프로그램 (없으면 null)
     */
    public AccrualDecision accrue(LoyaltyProgram program) {
        int visits = visitsCount + 1;
        int total = totalVisitsCount + 1;

        if (program != null && program.canMint() && visits >= program.targetVisits()) {
            LoyaltyMembership reset = new LoyaltyMembership(id, userId, merchantId,
                    visits - program.targetVisits(), total);
            return new AccrualDecision(reset, true);
        }
        return new AccrualDecision(new LoyaltyMembership(id, userId, merchantId, visits, total), false);
    }

    public record AccrualDecision(LoyaltyMembership membership, boolean rewardEarned) {
    }
}
