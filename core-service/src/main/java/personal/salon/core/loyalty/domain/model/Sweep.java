package personal.salon.core.loyalty.domain.model;

/**
 * 주기적으로 실행되는 적립/프로모션 스윕
 * 스윕 단위로 락을 잡으므로 key는 인스턴스 간에 동일해야 한다.
 */
public enum Sweep {
    LOYALTY_ACCRUAL("loyalty-accrual"),
    PROMOTION_EXPIRY("promotion-expiry");

    private final String key;

    Sweep(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
