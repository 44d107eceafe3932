package personal.salon.core.payment.domain.model;

/**
 * 사전 검증과 할인 계산이 끝난 정산 계획 (원자 단위의 입력)
 */
public record SettlementPlan(
        Long userId,
        Long creditCardId,
        Long billingAddressId,
        SettlementTarget target,
        PaymentAmount originalAmount,
        PaymentAmount chargedAmount,
        ResolvedDiscount discount) {
}
