package personal.salon.core.loyalty.application.port.in;

import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.util.List;

public interface IssueLoyalCustomerPromotionsUseCase {

    /**
     * 매장 단골 고객 전원에게 고유 코드 발급
     *
     * @return 발급된 프로모션 (대상이 없으면 빈 목록)
     */
    List<UserPromotion> issueToLoyalCustomers(IssueLoyalCustomerPromotionsCommand command);
}
