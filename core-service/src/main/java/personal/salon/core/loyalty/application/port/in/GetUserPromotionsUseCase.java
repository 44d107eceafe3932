package personal.salon.core.loyalty.application.port.in;

import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.util.List;

public interface GetUserPromotionsUseCase {

    /**
     * 고객이 받은 전체 프로모션 (모든 매장, 최근 발급 순)
     */
    List<UserPromotion> getPromotions(Long userId);
}
