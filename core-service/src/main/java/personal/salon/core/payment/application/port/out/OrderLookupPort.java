package personal.salon.core.payment.application.port.out;

import personal.salon.core.payment.domain.model.PurchaseOrder;

import java.util.Optional;

public interface OrderLookupPort {

    Optional<PurchaseOrder> findById(Long orderId);
}
