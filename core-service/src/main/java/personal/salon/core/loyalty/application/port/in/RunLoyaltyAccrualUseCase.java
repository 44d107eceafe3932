package personal.salon.core.loyalty.application.port.in;

import personal.salon.core.loyalty.domain.model.AccrualSweepSummary;

/**
 * 적립 스윕 1회 실행
 */
public interface RunLoyaltyAccrualUseCase {

    AccrualSweepSummary runAccrual();
}
