package personal.salon.core.payment.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

/**
 * 예상하지 못한 정산 실패 (내부 원인은 응답에 노출하지 않는다)
 */
public class SettlementFailedException extends BusinessException {
    public SettlementFailedException(String message) {
        super(ErrorCode.SETTLEMENT_FAILED, message);
    }

    public SettlementFailedException(String message, Throwable cause) {
        super(ErrorCode.SETTLEMENT_FAILED, message, cause);
    }
}
