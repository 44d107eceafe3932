package personal.salon.core.payment.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaPaymentRepository extends JpaRepository<PaymentEntity, Long> {

    List<PaymentEntity> findByReservationId(Long reservationId);
}
