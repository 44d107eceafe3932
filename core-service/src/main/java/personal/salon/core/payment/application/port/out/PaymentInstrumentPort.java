package personal.salon.core.payment.application.port.out;

/**
 * 결제 수단 소유권 조회 (카드, 청구지 주소)
 */
public interface PaymentInstrumentPort {

    boolean isCreditCardOwnedBy(Long creditCardId, Long userId);

    boolean isBillingAddressOwnedBy(Long billingAddressId, Long userId);
}
