package personal.salon.core.payment.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

public class BillingAddressNotFoundException extends BusinessException {
    public BillingAddressNotFoundException() {
        super(ErrorCode.BILLING_ADDRESS_NOT_FOUND, "Billing address not found or does not belong to you");
    }
}
