package personal.salon.core.payment.application.port.out;

import personal.salon.core.payment.domain.model.Payment;

import java.util.Optional;

/**
 * Payment Repository (Output Port)
 * 결제 기록은 추가만 가능하다.
 */
public interface PaymentRepository {

    Payment save(Payment payment);

    Optional<Payment> findById(Long paymentId);
}
