package personal.salon.core.payment.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaCreditCardRepository extends JpaRepository<CreditCardEntity, Long> {

    boolean existsByIdAndUserId(Long id, Long userId);
}
