package personal.salon.core.payment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Credit Card JPA Entity
 * 결제 수단 관리 컴포넌트 소유. 정산은 소유권 조회만 한다.
 */
@Entity
@Table(name = "credit_cards")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditCardEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "card_last4", length = 4)
    private String cardLast4;
}
