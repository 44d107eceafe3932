package personal.salon.core.payment.domain.model;

/**
 * 적용된 할인 종류
 */
public enum DiscountKind {
    NONE(null),
    REWARD("loyalty"),
    PROMO("promo");

    private final String label;

    DiscountKind(String label) {
        this.label = label;
    }

    /**
     * API 응답의 discountType 값 (할인이 없으면 null)
     */
    public String label() {
        return label;
    }
}
