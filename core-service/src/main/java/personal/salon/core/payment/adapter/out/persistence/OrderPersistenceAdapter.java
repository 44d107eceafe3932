package personal.salon.core.payment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.core.payment.application.port.out.OrderLookupPort;
import personal.salon.core.payment.domain.model.PurchaseOrder;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class OrderPersistenceAdapter implements OrderLookupPort {

    private final JpaOrderRepository jpaOrderRepository;

    @Override
    public Optional<PurchaseOrder> findById(Long orderId) {
        return jpaOrderRepository.findById(orderId).map(OrderEntity::toDomain);
    }
}
