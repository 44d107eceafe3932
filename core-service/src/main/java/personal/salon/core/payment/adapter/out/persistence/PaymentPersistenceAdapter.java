package personal.salon.core.payment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.core.payment.application.port.out.PaymentRepository;
import personal.salon.core.payment.domain.model.Payment;

import java.util.Optional;

/**
 * Payment Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentPersistenceAdapter implements PaymentRepository {

    private final JpaPaymentRepository jpaPaymentRepository;

    @Override
    public Payment save(Payment payment) {
        PaymentEntity saved = jpaPaymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment));
        log.debug("Payment saved: paymentId={}", saved.getId());
        return saved.toDomain();
    }

    @Override
    public Optional<Payment> findById(Long paymentId) {
        return jpaPaymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }
}
