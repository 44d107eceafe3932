package personal.salon.core.payment.domain.model;

/**
 * Payment Status
 * 결제 행의 존재 자체가 성공을 의미하므로 대기/실패 상태는 없다.
 */
public enum PaymentStatus {
    SUCCEEDED
}
