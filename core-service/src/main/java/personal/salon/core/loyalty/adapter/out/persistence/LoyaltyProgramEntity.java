package personal.salon.core.loyalty.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.core.loyalty.domain.model.LoyaltyProgram;

import java.math.BigDecimal;

/**
 * Loyalty Program JPA Entity (매장 관리 화면에서 관리, 여기서는 읽기 전용)
 */
@Entity
@Table(name = "loyalty_programs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoyaltyProgramEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "target_visits", nullable = false)
    private int targetVisits;

    @Column(name = "discount_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercentage;

    @Column(nullable = false)
    private boolean active;

    @Column(length = 255)
    private String note;

    public static LoyaltyProgramEntity fromDomain(LoyaltyProgram program) {
        LoyaltyProgramEntity entity = new LoyaltyProgramEntity();
        entity.id = program.id();
        entity.merchantId = program.merchantId();
        entity.targetVisits = program.targetVisits();
        entity.discountPercentage = program.discountPercentage();
        entity.active = program.active();
        entity.note = program.note();
        return entity;
    }

    public LoyaltyProgram toDomain() {
        return new LoyaltyProgram(id, merchantId, targetVisits, discountPercentage, active, note);
    }
}
