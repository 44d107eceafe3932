package personal.salon.core.loyalty.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.core.loyalty.domain.model.PromotionStatus;
import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * User Promotion JPA Entity
 */
@Entity
@Table(name = "user_promotions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_promotion_owner_code",
                columnNames = {"user_id", "merchant_id", "promo_code"}
        ),
        indexes = {
                @Index(name = "idx_promotion_status_expiry", columnList = "status, expires_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserPromotionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "promo_code", nullable = false, length = 50)
    private String code;

    @Column(name = "discount_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercentage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PromotionStatus status;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "redeemed_at")
    private LocalDateTime redeemedAt;

    @Column(name = "reservation_id")
    private Long reservationId;

    @Column(name = "payment_id")
    private Long paymentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static UserPromotionEntity fromDomain(UserPromotion promotion) {
        UserPromotionEntity entity = new UserPromotionEntity();
        entity.id = promotion.id();
        entity.userId = promotion.userId();
        entity.merchantId = promotion.merchantId();
        entity.code = promotion.code();
        entity.discountPercentage = promotion.discountPercentage();
        entity.status = promotion.status();
        entity.expiresAt = promotion.expiresAt();
        entity.redeemedAt = promotion.redeemedAt();
        entity.reservationId = promotion.reservationId();
        entity.paymentId = promotion.paymentId();
        entity.createdAt = promotion.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public UserPromotion toDomain() {
        return new UserPromotion(id, userId, merchantId, code, discountPercentage, status,
                expiresAt, redeemedAt, reservationId, paymentId, createdAt);
    }
}
