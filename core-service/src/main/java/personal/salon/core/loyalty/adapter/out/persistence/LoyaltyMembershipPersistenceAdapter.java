package personal.salon.core.loyalty.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.loyalty.application.port.out.LoyaltyMembershipRepository;
import personal.salon.core.loyalty.domain.model.LoyaltyMembership;

import java.util.List;
import java.util.Optional;

/**
 * Loyalty Membership Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoyaltyMembershipPersistenceAdapter implements LoyaltyMembershipRepository {

    private final JpaLoyaltyMembershipRepository jpaLoyaltyMembershipRepository;

    @Override
    public Optional<LoyaltyMembership> findForUpdate(Long userId, Long merchantId) {
        log.debug("Locking membership: userId={}, merchantId={}", userId, merchantId);
        return jpaLoyaltyMembershipRepository.findForUpdate(userId, merchantId)
                .map(LoyaltyMembershipEntity::toDomain);
    }

    @Override
    public Optional<LoyaltyMembership> find(Long userId, Long merchantId) {
        return jpaLoyaltyMembershipRepository.findByUserIdAndMerchantId(userId, merchantId)
                .map(LoyaltyMembershipEntity::toDomain);
    }

    @Override
    public List<LoyaltyMembership> findWithMinimumTotalVisits(Long merchantId, int minimumTotalVisits) {
        return jpaLoyaltyMembershipRepository
                .findByMerchantIdAndTotalVisitsCountGreaterThanEqualOrderByUserIdAsc(merchantId, minimumTotalVisits)
                .stream()
                .map(LoyaltyMembershipEntity::toDomain)
                .toList();
    }

    @Override
    public LoyaltyMembership create(LoyaltyMembership membership) {
        log.debug("Creating membership: userId={}, merchantId={}", membership.userId(), membership.merchantId());
        return jpaLoyaltyMembershipRepository.saveAndFlush(LoyaltyMembershipEntity.fromDomain(membership))
                .toDomain();
    }

    @Override
    public LoyaltyMembership save(LoyaltyMembership membership) {
        if (membership.id() == null) {
            return create(membership);
        }
        // 잠금 조회로 영속성 컨텍스트에 올라온 엔티티를 갱신
        LoyaltyMembershipEntity entity = jpaLoyaltyMembershipRepository.findById(membership.id())
                .orElseThrow(() -> new BusinessException(ErrorCode.NOT_FOUND,
                        "Membership not found: id=" + membership.id()));
        entity.updateCounts(membership.visitsCount(), membership.totalVisitsCount());
        return jpaLoyaltyMembershipRepository.saveAndFlush(entity).toDomain();
    }
}
