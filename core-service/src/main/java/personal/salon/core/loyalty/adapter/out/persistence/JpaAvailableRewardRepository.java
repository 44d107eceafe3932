package personal.salon.core.loyalty.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for AvailableReward
 */
public interface JpaAvailableRewardRepository extends JpaRepository<AvailableRewardEntity, Long> {

    @Query("SELECT r FROM AvailableRewardEntity r "
            + "WHERE r.id = :id AND r.userId = :userId AND r.merchantId = :merchantId "
            + "AND r.active = true AND r.redeemedAt IS NULL")
    Optional<AvailableRewardEntity> findRedeemable(@Param("id") Long id,
                                                   @Param("userId") Long userId,
                                                   @Param("merchantId") Long merchantId);

    /**
     * 소유권 + 활성 + 미사용 조건부 사용 처리
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AvailableRewardEntity r SET r.active = false, r.redeemedAt = :redeemedAt "
            + "WHERE r.id = :id AND r.userId = :userId AND r.merchantId = :merchantId "
            + "AND r.active = true AND r.redeemedAt IS NULL")
    int redeemIfAvailable(@Param("id") Long id,
                          @Param("userId") Long userId,
                          @Param("merchantId") Long merchantId,
                          @Param("redeemedAt") LocalDateTime redeemedAt);

    @Query("SELECT r FROM AvailableRewardEntity r "
            + "WHERE r.userId = :userId AND r.merchantId = :merchantId "
            + "AND r.active = true AND r.redeemedAt IS NULL ORDER BY r.createdAt ASC")
    List<AvailableRewardEntity> findRedeemableByOwner(@Param("userId") Long userId,
                                                      @Param("merchantId") Long merchantId);

    List<AvailableRewardEntity> findByUserIdAndMerchantIdOrderByCreatedAtDesc(Long userId, Long merchantId);
}
