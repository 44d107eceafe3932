package personal.salon.core.loyalty.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for LoyaltyMembership
 */
public interface JpaLoyaltyMembershipRepository extends JpaRepository<LoyaltyMembershipEntity, Long> {

    /**
     * SELECT ... FOR UPDATE
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM LoyaltyMembershipEntity m WHERE m.userId = :userId AND m.merchantId = :merchantId")
    Optional<LoyaltyMembershipEntity> findForUpdate(@Param("userId") Long userId,
                                                    @Param("merchantId") Long merchantId);

    Optional<LoyaltyMembershipEntity> findByUserIdAndMerchantId(Long userId, Long merchantId);

    List<LoyaltyMembershipEntity> findByMerchantIdAndTotalVisitsCountGreaterThanEqualOrderByUserIdAsc(
            Long merchantId, int totalVisitsCount);
}
