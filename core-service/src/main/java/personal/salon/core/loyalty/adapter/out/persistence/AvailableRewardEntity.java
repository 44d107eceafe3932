package personal.salon.core.loyalty.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.core.loyalty.domain.model.AvailableReward;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Available Reward JPA Entity
 */
@Entity
@Table(name = "available_rewards",
        indexes = {
                @Index(name = "idx_reward_owner", columnList = "user_id, merchant_id, active")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AvailableRewardEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "discount_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercentage;

    @Column(length = 255)
    private String note;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "redeemed_at")
    private LocalDateTime redeemedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static AvailableRewardEntity fromDomain(AvailableReward reward) {
        AvailableRewardEntity entity = new AvailableRewardEntity();
        entity.id = reward.id();
        entity.userId = reward.userId();
        entity.merchantId = reward.merchantId();
        entity.discountPercentage = reward.discountPercentage();
        entity.note = reward.note();
        entity.active = reward.active();
        entity.redeemedAt = reward.redeemedAt();
        entity.createdAt = reward.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public AvailableReward toDomain() {
        return new AvailableReward(id, userId, merchantId, discountPercentage, note,
                active, redeemedAt, createdAt);
    }
}
