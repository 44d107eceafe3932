package personal.salon.core.payment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.core.payment.application.port.out.PaymentInstrumentPort;

/**
 * 결제 수단 소유권 조회 (없음과 타인 소유를 구분하지 않는다)
 */
@Component
@RequiredArgsConstructor
public class PaymentInstrumentPersistenceAdapter implements PaymentInstrumentPort {

    private final JpaCreditCardRepository jpaCreditCardRepository;
    private final JpaBillingAddressRepository jpaBillingAddressRepository;

    @Override
    public boolean isCreditCardOwnedBy(Long creditCardId, Long userId) {
        return jpaCreditCardRepository.existsByIdAndUserId(creditCardId, userId);
    }

    @Override
    public boolean isBillingAddressOwnedBy(Long billingAddressId, Long userId) {
        return jpaBillingAddressRepository.existsByIdAndUserId(billingAddressId, userId);
    }
}
