package personal.salon.core.loyalty.domain.model;

/**
 * 적립 스윕 1회 실행 요약
 */
public record AccrualSweepSummary(
        int candidates,
        int accrued,
        int minted,
        int skipped,
        int failed,
        int canceledMarked) {

    public boolean isIdle() {
        return candidates == 0 && canceledMarked == 0;
    }
}
