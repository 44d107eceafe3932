package personal.salon.core.loyalty.application.port.in;

import personal.salon.core.loyalty.domain.model.LoyaltyStatus;

public interface GetLoyaltyStatusUseCase {

    LoyaltyStatus getLoyaltyStatus(Long userId, Long merchantId);
}
