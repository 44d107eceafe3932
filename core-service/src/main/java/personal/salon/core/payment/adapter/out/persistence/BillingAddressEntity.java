package personal.salon.core.payment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Billing Address JPA Entity (읽기 전용)
 */
@Entity
@Table(name = "billing_addresses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BillingAddressEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "address_line", length = 255)
    private String addressLine;

    @Column(name = "postal_code", length = 20)
    private String postalCode;
}
