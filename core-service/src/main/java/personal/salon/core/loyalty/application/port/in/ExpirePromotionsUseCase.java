package personal.salon.core.loyalty.application.port.in;

public interface ExpirePromotionsUseCase {

    /**
     * @return 만료 처리된 프로모션 수
     */
    int expireOverduePromotions();
}
