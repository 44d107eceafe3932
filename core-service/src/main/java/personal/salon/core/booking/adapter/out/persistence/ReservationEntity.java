package personal.salon.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.core.booking.domain.model.LoyaltySeen;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑. 행 생성은 외부 예약 컴포넌트가 담당한다.
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_status_loyalty_seen", columnList = "status, loyalty_seen, scheduled_end")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "scheduled_start")
    private LocalDateTime scheduledStart;

    @Column(name = "scheduled_end")
    private LocalDateTime scheduledEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "loyalty_seen", nullable = false, length = 20)
    private LoyaltySeen loyaltySeen;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reservation_staff", joinColumns = @JoinColumn(name = "reservation_id"))
    @Column(name = "staff_user_id")
    private Set<Long> staffUserIds = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.id = reservation.id();
        entity.userId = reservation.customerId();
        entity.merchantId = reservation.merchantId();
        entity.scheduledStart = reservation.scheduledStart();
        entity.scheduledEnd = reservation.scheduledEnd();
        entity.status = reservation.status();
        entity.loyaltySeen = reservation.loyaltySeen();
        entity.staffUserIds = new HashSet<>(reservation.staffUserIds());
        entity.createdAt = reservation.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (loyaltySeen == null) {
            loyaltySeen = LoyaltySeen.UNPROCESSED;
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Reservation toDomain() {
        return new Reservation(id, userId, merchantId, scheduledStart, scheduledEnd,
                status, loyaltySeen, staffUserIds, createdAt);
    }
}
