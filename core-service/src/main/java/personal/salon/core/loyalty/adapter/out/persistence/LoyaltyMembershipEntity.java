package personal.salon.core.loyalty.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.core.loyalty.domain.model.LoyaltyMembership;

import java.time.LocalDateTime;

/**
 * Loyalty Membership JPA Entity
 * (user_id, merchant_id) 유니크 키로 지연 생성 중복을 막는다.
 */
@Entity
@Table(name = "loyalty_memberships",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_membership_user_merchant",
                columnNames = {"user_id", "merchant_id"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoyaltyMembershipEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "visits_count", nullable = false)
    private int visitsCount;

    @Column(name = "total_visits_count", nullable = false)
    private int totalVisitsCount;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static LoyaltyMembershipEntity fromDomain(LoyaltyMembership membership) {
        LoyaltyMembershipEntity entity = new LoyaltyMembershipEntity();
        entity.id = membership.id();
        entity.userId = membership.userId();
        entity.merchantId = membership.merchantId();
        entity.visitsCount = membership.visitsCount();
        entity.totalVisitsCount = membership.totalVisitsCount();
        return entity;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * 영속성 컨텍스트 내 카운터 갱신 (잠금 조회한 엔티티에만 사용)
     */
    public void updateCounts(int visitsCount, int totalVisitsCount) {
        this.visitsCount = visitsCount;
        this.totalVisitsCount = totalVisitsCount;
    }

    public LoyaltyMembership toDomain() {
        return new LoyaltyMembership(id, userId, merchantId, visitsCount, totalVisitsCount);
    }
}
