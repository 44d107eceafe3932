package personal.salon.core.loyalty.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.core.loyalty.application.port.in.GetAvailableRewardsUseCase;
import personal.salon.core.loyalty.application.port.in.GetLoyaltyStatusUseCase;
import personal.salon.core.loyalty.application.port.in.GetUserPromotionsUseCase;
import personal.salon.core.loyalty.application.port.out.LoyaltyMembershipRepository;
import personal.salon.core.loyalty.application.port.out.LoyaltyProgramRepository;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.exception.LoyaltyProgramNotFoundException;
import personal.salon.core.loyalty.domain.model.AvailableReward;
import personal.salon.core.loyalty.domain.model.LoyaltyMembership;
import personal.salon.core.loyalty.domain.model.LoyaltyProgram;
import personal.salon.core.loyalty.domain.model.LoyaltyStatus;
import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.util.List;

/**
 * Loyalty Query Service
 * 리워드 목록, 적립 현황, 보유 프로모션 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class LoyaltyQueryService implements GetAvailableRewardsUseCase, GetLoyaltyStatusUseCase,
        GetUserPromotionsUseCase {

    private final RewardLedger rewardLedger;
    private final LoyaltyMembershipRepository membershipRepository;
    private final LoyaltyProgramRepository programRepository;
    private final PromotionLedger promotionLedger;

    @Override
    public List<AvailableReward> getAvailableRewards(Long userId, Long merchantId) {
        return rewardLedger.findRedeemableByOwner(userId, merchantId);
    }

    @Override
    public LoyaltyStatus getLoyaltyStatus(Long userId, Long merchantId) {
        LoyaltyProgram program = programRepository.findActiveByMerchant(merchantId)
                .orElseThrow(() -> new LoyaltyProgramNotFoundException(merchantId));

        LoyaltyMembership membership = membershipRepository.find(userId, merchantId)
                .orElse(LoyaltyMembership.start(userId, merchantId));

        return new LoyaltyStatus(
                merchantId,
                membership.visitsCount(),
                membership.totalVisitsCount(),
                program,
                rewardLedger.findAllByOwner(userId, merchantId));
    }

    @Override
    public List<UserPromotion> getPromotions(Long userId) {
        return promotionLedger.findAllByOwner(userId);
    }
}
