package personal.salon.core.payment.application.port.in;

import personal.salon.core.payment.domain.model.SettlementResult;

public interface SettlePaymentUseCase {

    SettlementResult settle(SettlePaymentCommand command);
}
