package personal.salon.core.loyalty.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.model.AvailableReward;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reward Ledger Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewardLedgerAdapter implements RewardLedger {

    private final JpaAvailableRewardRepository jpaAvailableRewardRepository;

    @Override
    public Optional<AvailableReward> findRedeemable(Long rewardId, Long userId, Long merchantId) {
        log.debug("Finding redeemable reward: rewardId={}, userId={}, merchantId={}", rewardId, userId, merchantId);
        return jpaAvailableRewardRepository.findRedeemable(rewardId, userId, merchantId)
                .map(AvailableRewardEntity::toDomain);
    }

    @Override
    public boolean redeem(Long rewardId, Long userId, Long merchantId, LocalDateTime redeemedAt) {
        int updated = jpaAvailableRewardRepository.redeemIfAvailable(rewardId, userId, merchantId, redeemedAt);
        log.debug("Reward redeem CAS: rewardId={}, updated={}", rewardId, updated);
        return updated == 1;
    }

    @Override
    public AvailableReward mint(AvailableReward reward) {
        return jpaAvailableRewardRepository.save(AvailableRewardEntity.fromDomain(reward)).toDomain();
    }

    @Override
    public List<AvailableReward> findRedeemableByOwner(Long userId, Long merchantId) {
        return jpaAvailableRewardRepository.findRedeemableByOwner(userId, merchantId)
                .stream()
                .map(AvailableRewardEntity::toDomain)
                .toList();
    }

    @Override
    public List<AvailableReward> findAllByOwner(Long userId, Long merchantId) {
        return jpaAvailableRewardRepository.findByUserIdAndMerchantIdOrderByCreatedAtDesc(userId, merchantId)
                .stream()
                .map(AvailableRewardEntity::toDomain)
                .toList();
    }
}
