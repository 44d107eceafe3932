package personal.salon.core.payment.domain.model;

import personal.salon.core.payment.domain.exception.OrderAccessDeniedException;

/**
 * 상품 주문 (외부 장바구니/주문 컴포넌트 소유, 결제 시 읽기 전용)
 */
public record PurchaseOrder(
        Long id,
        Long userId,
        Long merchantId) {

    public void ensureOwnership(Long requestUserId) {
        if (!userId.equals(requestUserId)) {
            throw new OrderAccessDeniedException(id);
        }
    }
}
