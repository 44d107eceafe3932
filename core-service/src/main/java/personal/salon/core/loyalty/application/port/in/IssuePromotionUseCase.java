package personal.salon.core.loyalty.application.port.in;

import personal.salon.core.loyalty.domain.model.UserPromotion;

public interface IssuePromotionUseCase {

    UserPromotion issuePromotion(IssuePromotionCommand command);
}
