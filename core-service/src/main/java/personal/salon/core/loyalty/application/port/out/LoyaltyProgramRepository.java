package personal.salon.core.loyalty.application.port.out;

import personal.salon.core.loyalty.domain.model.LoyaltyProgram;

import java.util.Optional;

/**
 * 매장 적립 프로그램 조회 (읽기 전용)
 */
public interface LoyaltyProgramRepository {

    Optional<LoyaltyProgram> findActiveByMerchant(Long merchantId);
}
