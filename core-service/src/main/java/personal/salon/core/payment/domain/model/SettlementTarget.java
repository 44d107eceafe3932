package personal.salon.core.payment.domain.model;

import personal.salon.core.booking.domain.model.Reservation;

/**
 * 결제 대상 (예약 또는 주문 중 정확히 하나)
 */
public record SettlementTarget(Reservation reservation, PurchaseOrder order) {

    public SettlementTarget {
        if ((reservation == null) == (order == null)) {
            throw new IllegalArgumentException("Exactly one of reservation or order must be set");
        }
    }

    public static SettlementTarget of(Reservation reservation) {
        return new SettlementTarget(reservation, null);
    }

    public static SettlementTarget of(PurchaseOrder order) {
        return new SettlementTarget(null, order);
    }

    public boolean isReservation() {
        return reservation != null;
    }

    public Long merchantId() {
        return isReservation() ? reservation.merchantId() : order.merchantId();
    }

    public Long reservationId() {
        return isReservation() ? reservation.id() : null;
    }

    public Long orderId() {
        return isReservation() ? null : order.id();
    }
}
