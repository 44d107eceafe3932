package personal.salon.core.loyalty.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.salon.core.loyalty.domain.model.PromotionStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for UserPromotion
 */
public interface JpaUserPromotionRepository extends JpaRepository<UserPromotionEntity, Long> {

    Optional<UserPromotionEntity> findByUserIdAndMerchantIdAndCode(Long userId, Long merchantId, String code);

    boolean existsByUserIdAndMerchantIdAndCode(Long userId, Long merchantId, String code);

    boolean existsByMerchantIdAndCode(Long merchantId, String code);

    List<UserPromotionEntity> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    /**
     * ISSUED 상태일 때만 사용 처리하고 사용 내역 기록
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UserPromotionEntity p SET p.status = :redeemed, p.redeemedAt = :redeemedAt, "
            + "p.reservationId = :reservationId, p.paymentId = :paymentId "
            + "WHERE p.id = :id AND p.userId = :userId AND p.merchantId = :merchantId AND p.status = :issued")
    int redeemIfIssued(@Param("id") Long id,
                       @Param("userId") Long userId,
                       @Param("merchantId") Long merchantId,
                       @Param("redeemedAt") LocalDateTime redeemedAt,
                       @Param("reservationId") Long reservationId,
                       @Param("paymentId") Long paymentId,
                       @Param("issued") PromotionStatus issued,
                       @Param("redeemed") PromotionStatus redeemed);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UserPromotionEntity p SET p.status = :expired "
            + "WHERE p.status = :issued AND p.expiresAt IS NOT NULL AND p.expiresAt < :now")
    int expireOverdue(@Param("now") LocalDateTime now,
                      @Param("issued") PromotionStatus issued,
                      @Param("expired") PromotionStatus expired);
}
