package personal.salon.core.payment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.core.payment.domain.model.DiscountKind;
import personal.salon.core.payment.domain.model.Payment;
import personal.salon.core.payment.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment JPA Entity
 * 추가 전용 (수정 없음)
 */
@Entity
@Table(name = "payments",
        indexes = {
                @Index(name = "idx_payment_user", columnList = "user_id"),
                @Index(name = "idx_payment_reservation", columnList = "reservation_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "credit_card_id", nullable = false, updatable = false)
    private Long creditCardId;

    @Column(name = "billing_address_id", nullable = false, updatable = false)
    private Long billingAddressId;

    @Column(name = "reservation_id", updatable = false)
    private Long reservationId;

    @Column(name = "order_id", updatable = false)
    private Long orderId;

    @Column(name = "merchant_id", updatable = false)
    private Long merchantId;

    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(name = "original_amount", precision = 12, scale = 2, updatable = false)
    private BigDecimal originalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_kind", nullable = false, length = 10, updatable = false)
    private DiscountKind discountKind;

    @Column(name = "reward_id", updatable = false)
    private Long rewardId;

    @Column(name = "promotion_id", updatable = false)
    private Long promotionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private PaymentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static PaymentEntity fromDomain(Payment payment) {
        PaymentEntity entity = new PaymentEntity();
        entity.id = payment.id();
        entity.userId = payment.userId();
        entity.creditCardId = payment.creditCardId();
        entity.billingAddressId = payment.billingAddressId();
        entity.reservationId = payment.reservationId();
        entity.orderId = payment.orderId();
        entity.merchantId = payment.merchantId();
        entity.amount = payment.amount();
        entity.originalAmount = payment.originalAmount();
        entity.discountKind = payment.discountKind();
        entity.rewardId = payment.rewardId();
        entity.promotionId = payment.promotionId();
        entity.status = payment.status();
        entity.createdAt = payment.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Payment toDomain() {
        return new Payment(id, userId, creditCardId, billingAddressId, reservationId, orderId, merchantId,
                amount, originalAmount, discountKind, rewardId, promotionId, status, createdAt);
    }
}
