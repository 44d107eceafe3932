package personal.salon.core.loyalty.domain.model;

/**
 * 예약 1건 적립 처리 결과
 * 예외 대신 결과 타입으로 실패를 격리한다.
 *
 * @param reward REWARD_MINTED일 때 발급된 리워드
 * @param reason SKIPPED / FAILED 사유
 */
public record AccrualResult(
        Long reservationId,
        Outcome outcome,
        AvailableReward reward,
        String reason) {

    public enum Outcome {
        /** 방문 수만 증가 */
        ACCRUED,
        /** 방문 수 증가 + 리워드 발급 */
        REWARD_MINTED,
        /** 다른 작업자가 먼저 처리함 (롤백) */
        SKIPPED,
        /** 트랜잭션 실패 (롤백, 다음 주기에 재시도) */
        FAILED
    }

    public static AccrualResult accrued(Long reservationId) {
        return new AccrualResult(reservationId, Outcome.ACCRUED, null, null);
    }

    public static AccrualResult minted(Long reservationId, AvailableReward reward) {
        return new AccrualResult(reservationId, Outcome.REWARD_MINTED, reward, null);
    }

    public static AccrualResult skipped(Long reservationId, String reason) {
        return new AccrualResult(reservationId, Outcome.SKIPPED, null, reason);
    }

    public static AccrualResult failed(Long reservationId, String reason) {
        return new AccrualResult(reservationId, Outcome.FAILED, null, reason);
    }
}
