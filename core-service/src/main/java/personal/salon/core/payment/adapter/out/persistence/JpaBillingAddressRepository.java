package personal.salon.core.payment.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaBillingAddressRepository extends JpaRepository<BillingAddressEntity, Long> {

    boolean existsByIdAndUserId(Long id, Long userId);
}
