package personal.salon.core.payment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.notification.application.port.in.RequestNotificationUseCase;
import personal.salon.core.notification.domain.model.NotificationCategory;
import personal.salon.core.notification.domain.model.NotificationRequest;
import personal.salon.core.payment.domain.model.Payment;
import personal.salon.core.payment.domain.model.ResolvedDiscount;
import personal.salon.core.payment.domain.model.SettlementPlan;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;

/**
 * Settlement Notifier
 * 정산 성공 후 고객/스태프 알림을 요청한다. 알림 실패는 로그만 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementNotifier {

    private static final DateTimeFormatter SCHEDULE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final RequestNotificationUseCase requestNotificationUseCase;

    public void notifySettled(Payment payment, SettlementPlan plan) {
        ResolvedDiscount discount = plan.discount();
        switch (discount.kind()) {
            case REWARD -> send(payment, payment.userId(), NotificationCategory.REWARD_REDEEMED,
                    String.format("Your %s%% loyalty reward was applied to your payment.",
                            percent(discount.percentage())));
            case PROMO -> send(payment, payment.userId(), NotificationCategory.PROMO_REDEEMED,
                    String.format("Promo code %s was applied (%s%% off).",
                            discount.promoCode(), percent(discount.percentage())));
            case NONE -> {
            }
        }

        if (!plan.target().isReservation()) {
            return;
        }
        Reservation reservation = plan.target().reservation();
        String scheduledAt = reservation.scheduledStart() == null
                ? "your scheduled time"
                : reservation.scheduledStart().format(SCHEDULE_FORMAT);

        send(payment, payment.userId(), NotificationCategory.BOOKING_CONFIRMED,
                String.format("Your appointment on %s has been confirmed.", scheduledAt));
        for (Long staffUserId : reservation.staffUserIds()) {
            send(payment, staffUserId, NotificationCategory.BOOKING_CONFIRMED_STAFF,
                    String.format("A new appointment on %s has been confirmed.", scheduledAt));
        }
    }

    private void send(Payment payment, Long recipientUserId, NotificationCategory category, String message) {
        try {
            requestNotificationUseCase.request(new NotificationRequest(
                    recipientUserId,
                    category,
                    message,
                    payment.merchantId(),
                    payment.reservationId(),
                    payment.id()));
        } catch (RuntimeException e) {
            log.warn("Failed to request notification: category={}, recipient={}, paymentId={}",
                    category, recipientUserId, payment.id(), e);
        }
    }

    private static String percent(BigDecimal percentage) {
        return percentage.stripTrailingZeros().toPlainString();
    }
}
