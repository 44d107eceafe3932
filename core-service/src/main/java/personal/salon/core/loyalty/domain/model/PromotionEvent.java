package personal.salon.core.loyalty.domain.model;

public enum PromotionEvent {
    REDEEM,
    EXPIRE
}
