package personal.salon.core.payment.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.booking.domain.exception.ReservationConflictException;
import personal.salon.core.booking.domain.exception.ReservationNotPendingException;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.booking.domain.model.ReservationStatus;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.exception.PromoExpiredException;
import personal.salon.core.loyalty.domain.exception.RewardNoLongerAvailableException;
import personal.salon.core.loyalty.domain.model.AvailableReward;
import personal.salon.core.loyalty.domain.model.PromotionStatus;
import personal.salon.core.loyalty.domain.model.UserPromotion;
import personal.salon.core.notification.application.port.in.RequestNotificationUseCase;
import personal.salon.core.notification.domain.model.NotificationCategory;
import personal.salon.core.notification.domain.model.NotificationRequest;
import personal.salon.core.payment.application.port.in.SettlePaymentCommand;
import personal.salon.core.payment.application.port.out.OrderLookupPort;
import personal.salon.core.payment.application.port.out.PaymentInstrumentPort;
import personal.salon.core.payment.application.port.out.PaymentRepository;
import personal.salon.core.payment.application.port.out.ReservationConfirmationPort;
import personal.salon.core.payment.application.port.out.ReservationReleasePort;
import personal.salon.core.payment.application.port.out.ReservationValidationPort;
import personal.salon.core.payment.domain.exception.BillingAddressNotFoundException;
import personal.salon.core.payment.domain.exception.CreditCardNotFoundException;
import personal.salon.core.payment.domain.exception.InvalidPaymentTargetException;
import personal.salon.core.payment.domain.exception.OrderAccessDeniedException;
import personal.salon.core.payment.domain.exception.SettlementFailedException;
import personal.salon.core.payment.domain.model.DiscountKind;
import personal.salon.core.payment.domain.model.Payment;
import personal.salon.core.payment.domain.model.PurchaseOrder;
import personal.salon.core.payment.domain.model.ReleaseOutcome;
import personal.salon.core.payment.domain.model.SettlementResult;
import personal.salon.core.payment.domain.service.DiscountResolver;
import personal.salon.core.payment.domain.service.SettlementManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentSettlementService 단위 테스트")
class PaymentSettlementServiceTest {

    private static final Long USER_ID = 10L;
    private static final Long MERCHANT_ID = 100L;
    private static final Long RESERVATION_ID = 1L;
    private static final Long CARD_ID = 20L;
    private static final Long ADDRESS_ID = 30L;
    private static final Long PAYMENT_ID = 900L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 5, 1, 12, 0);

    @Mock
    private PaymentInstrumentPort paymentInstrumentPort;
    @Mock
    private ReservationValidationPort reservationValidationPort;
    @Mock
    private OrderLookupPort orderLookupPort;
    @Mock
    private RewardLedger rewardLedger;
    @Mock
    private PromotionLedger promotionLedger;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private ReservationConfirmationPort reservationConfirmationPort;
    @Mock
    private ReservationReleasePort reservationReleasePort;
    @Mock
    private RequestNotificationUseCase requestNotificationUseCase;

    private PaymentSettlementService settlementService;
    private Reservation pendingReservation;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneId.of("UTC"));
        DiscountResolver discountResolver = new DiscountResolver(rewardLedger, promotionLedger, clock);
        SettlementManager settlementManager = new SettlementManager(paymentRepository, rewardLedger,
                promotionLedger, reservationConfirmationPort, clock);
        settlementService = new PaymentSettlementService(paymentInstrumentPort, reservationValidationPort,
                orderLookupPort, discountResolver, settlementManager, reservationReleasePort,
                new SettlementNotifier(requestNotificationUseCase));

        pendingReservation = new Reservation(RESERVATION_ID, USER_ID, MERCHANT_ID, NOW.plusDays(2),
                NOW.plusDays(2).plusHours(1), ReservationStatus.PENDING, null, Set.of(501L, 502L), NOW);
    }

    private static SettlePaymentCommand reservationCommand(String amount, Long rewardId, String promoCode) {
        return new SettlePaymentCommand(USER_ID, CARD_ID, ADDRESS_ID, new BigDecimal(amount),
                RESERVATION_ID, null, rewardId, promoCode);
    }

    private void givenValidInstrumentsAndReservation() {
        given(paymentInstrumentPort.isCreditCardOwnedBy(CARD_ID, USER_ID)).willReturn(true);
        given(paymentInstrumentPort.isBillingAddressOwnedBy(ADDRESS_ID, USER_ID)).willReturn(true);
        given(reservationValidationPort.validateForPayment(RESERVATION_ID, USER_ID)).willReturn(pendingReservation);
    }

    private void givenPaymentSaved() {
        given(paymentRepository.save(any(Payment.class))).willAnswer(invocation -> {
            Payment p = invocation.getArgument(0);
            return new Payment(PAYMENT_ID, p.userId(), p.creditCardId(), p.billingAddressId(), p.reservationId(),
                    p.orderId(), p.merchantId(), p.amount(), p.originalAmount(), p.discountKind(), p.rewardId(),
                    p.promotionId(), p.status(), p.createdAt());
        });
    }

    @Nested
    @DisplayName("정산 성공")
    class Success {

        @Test
        @DisplayName("할인 없이 예약 결제 시 예약이 확정되고 원금 정보는 없다")
        void settle_NoDiscount() {
            // given
            givenValidInstrumentsAndReservation();
            givenPaymentSaved();
            given(reservationConfirmationPort.confirmSettled(pendingReservation)).willReturn(true);

            // when
            SettlementResult result = settlementService.settle(reservationCommand("55.555", null, null));

            // then
            assertThat(result.paymentId()).isEqualTo(PAYMENT_ID);
            assertThat(result.amount()).isEqualByComparingTo("55.56");
            assertThat(result.originalAmount()).isNull();
            assertThat(result.discountKind()).isEqualTo(DiscountKind.NONE);
            assertThat(result.reservationConfirmed()).isTrue();
            verify(reservationReleasePort, never()).release(anyLong(), anyLong());
        }

        @Test
        @DisplayName("20% 리워드 적용 시 100은 80으로 결제되고 리워드가 사용 처리된다")
        void settle_WithReward() {
            // given
            givenValidInstrumentsAndReservation();
            givenPaymentSaved();
            given(rewardLedger.findRedeemable(3L, USER_ID, MERCHANT_ID)).willReturn(Optional.of(
                    new AvailableReward(3L, USER_ID, MERCHANT_ID, new BigDecimal("20"), null, true, null, NOW)));
            given(rewardLedger.redeem(3L, USER_ID, MERCHANT_ID, NOW)).willReturn(true);
            given(reservationConfirmationPort.confirmSettled(pendingReservation)).willReturn(true);

            // when
            SettlementResult result = settlementService.settle(reservationCommand("100", 3L, null));

            // then
            assertThat(result.amount()).isEqualByComparingTo("80.00");
            assertThat(result.originalAmount()).isEqualByComparingTo("100.00");
            assertThat(result.discountKind().label()).isEqualTo("loyalty");

            ArgumentCaptor<Payment> saved = ArgumentCaptor.forClass(Payment.class);
            verify(paymentRepository).save(saved.capture());
            assertThat(saved.getValue().rewardId()).isEqualTo(3L);
            assertThat(saved.getValue().promotionId()).isNull();
        }

        @Test
        @DisplayName("프로모션 사용 시 결제 ID와 예약 ID가 사용 내역으로 기록된다")
        void settle_WithPromo() {
            // given
            givenValidInstrumentsAndReservation();
            givenPaymentSaved();
            given(promotionLedger.findByCode(USER_ID, MERCHANT_ID, "WELCOME")).willReturn(Optional.of(
                    new UserPromotion(7L, USER_ID, MERCHANT_ID, "WELCOME", new BigDecimal("10"),
                            PromotionStatus.ISSUED, NOW.plusDays(1), null, null, null, NOW.minusDays(1))));
            given(promotionLedger.redeem(7L, USER_ID, MERCHANT_ID, NOW, RESERVATION_ID, PAYMENT_ID)).willReturn(true);
            given(reservationConfirmationPort.confirmSettled(pendingReservation)).willReturn(true);

            // when
            SettlementResult result = settlementService.settle(reservationCommand("50", null, "WELCOME"));

            // then
            assertThat(result.amount()).isEqualByComparingTo("45.00");
            assertThat(result.discountKind().label()).isEqualTo("promo");
            verify(promotionLedger).redeem(7L, USER_ID, MERCHANT_ID, NOW, RESERVATION_ID, PAYMENT_ID);
        }

        @Test
        @DisplayName("예약 확정 시 고객과 배정된 스태프 모두에게 알림을 요청한다")
        void settle_NotifiesCustomerAndStaff() {
            // given
            givenValidInstrumentsAndReservation();
            givenPaymentSaved();
            given(reservationConfirmationPort.confirmSettled(pendingReservation)).willReturn(true);

            // when
            settlementService.settle(reservationCommand("30", null, null));

            // then
            ArgumentCaptor<NotificationRequest> requests = ArgumentCaptor.forClass(NotificationRequest.class);
            verify(requestNotificationUseCase, times(3)).request(requests.capture());
            List<NotificationRequest> sent = requests.getAllValues();
            assertThat(sent).extracting(NotificationRequest::category).containsExactlyInAnyOrder(
                    NotificationCategory.BOOKING_CONFIRMED,
                    NotificationCategory.BOOKING_CONFIRMED_STAFF,
                    NotificationCategory.BOOKING_CONFIRMED_STAFF);
            assertThat(sent).extracting(NotificationRequest::recipientUserId)
                    .containsExactlyInAnyOrder(USER_ID, 501L, 502L);
        }

        @Test
        @DisplayName("알림 요청이 실패해도 정산은 성공한다")
        void settle_NotificationFailureIsNonFatal() {
            // given
            givenValidInstrumentsAndReservation();
            givenPaymentSaved();
            given(reservationConfirmationPort.confirmSettled(pendingReservation)).willReturn(true);
            willThrow(new IllegalStateException("outbox down")).given(requestNotificationUseCase).request(any());

            // when
            SettlementResult result = settlementService.settle(reservationCommand("30", null, null));

            // then
            assertThat(result.paymentId()).isEqualTo(PAYMENT_ID);
            verify(reservationReleasePort, never()).release(anyLong(), anyLong());
        }

        @Test
        @DisplayName("주문 결제는 예약 확정 없이 처리된다")
        void settle_Order() {
            // given
            given(paymentInstrumentPort.isCreditCardOwnedBy(CARD_ID, USER_ID)).willReturn(true);
            given(paymentInstrumentPort.isBillingAddressOwnedBy(ADDRESS_ID, USER_ID)).willReturn(true);
            given(orderLookupPort.findById(5L)).willReturn(Optional.of(new PurchaseOrder(5L, USER_ID, MERCHANT_ID)));
            givenPaymentSaved();

            // when
            SettlementResult result = settlementService.settle(new SettlePaymentCommand(USER_ID, CARD_ID, ADDRESS_ID,
                    new BigDecimal("12.5"), null, 5L, null, null));

            // then
            assertThat(result.reservationConfirmed()).isFalse();
            verify(reservationConfirmationPort, never()).confirmSettled(any());
        }
    }

    @Nested
    @DisplayName("사전 검증 실패")
    class Preconditions {

        @Test
        @DisplayName("필수 값이 없으면 INVALID_INPUT")
        void settle_MissingFields() {
            SettlePaymentCommand command = new SettlePaymentCommand(USER_ID, null, ADDRESS_ID,
                    new BigDecimal("10"), RESERVATION_ID, null, null, null);

            assertThatThrownBy(() -> settlementService.settle(command))
                    .isInstanceOf(BusinessException.class)
                    .hasMessage("Required fields: creditCardId, billingAddressId, amount")
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_INPUT);
        }

        @Test
        @DisplayName("예약과 주문을 모두 지정하면 거부된다")
        void settle_BothTargets() {
            SettlePaymentCommand command = new SettlePaymentCommand(USER_ID, CARD_ID, ADDRESS_ID,
                    new BigDecimal("10"), RESERVATION_ID, 5L, null, null);

            assertThatThrownBy(() -> settlementService.settle(command))
                    .isInstanceOf(InvalidPaymentTargetException.class);
        }

        @Test
        @DisplayName("인증 정보가 없으면 UNAUTHORIZED이며 해제를 시도하지 않는다")
        void settle_Unauthorized() {
            SettlePaymentCommand command = new SettlePaymentCommand(null, CARD_ID, ADDRESS_ID,
                    new BigDecimal("10"), RESERVATION_ID, null, null, null);

            assertThatThrownBy(() -> settlementService.settle(command))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.UNAUTHORIZED);
            verify(reservationReleasePort, never()).release(any(), any());
        }

        @Test
        @DisplayName("다른 사람의 카드면 CreditCardNotFound")
        void settle_ForeignCard() {
            given(paymentInstrumentPort.isCreditCardOwnedBy(CARD_ID, USER_ID)).willReturn(false);

            assertThatThrownBy(() -> settlementService.settle(reservationCommand("10", null, null)))
                    .isInstanceOf(CreditCardNotFoundException.class);
        }

        @Test
        @DisplayName("다른 사람의 청구지 주소면 BillingAddressNotFound")
        void settle_ForeignAddress() {
            given(paymentInstrumentPort.isCreditCardOwnedBy(CARD_ID, USER_ID)).willReturn(true);
            given(paymentInstrumentPort.isBillingAddressOwnedBy(ADDRESS_ID, USER_ID)).willReturn(false);

            assertThatThrownBy(() -> settlementService.settle(reservationCommand("10", null, null)))
                    .isInstanceOf(BillingAddressNotFoundException.class);
        }

        @Test
        @DisplayName("다른 사람의 주문이면 OrderAccessDenied")
        void settle_ForeignOrder() {
            given(paymentInstrumentPort.isCreditCardOwnedBy(CARD_ID, USER_ID)).willReturn(true);
            given(paymentInstrumentPort.isBillingAddressOwnedBy(ADDRESS_ID, USER_ID)).willReturn(true);
            given(orderLookupPort.findById(5L)).willReturn(Optional.of(new PurchaseOrder(5L, 99L, MERCHANT_ID)));

            assertThatThrownBy(() -> settlementService.settle(new SettlePaymentCommand(USER_ID, CARD_ID, ADDRESS_ID,
                    new BigDecimal("10"), null, 5L, null, null)))
                    .isInstanceOf(OrderAccessDeniedException.class);
            verify(reservationReleasePort, never()).release(any(), any());
        }

        @Test
        @DisplayName("만료된 프로모션이면 결제가 생성되지 않는다")
        void settle_ExpiredPromo() {
            // given
            givenValidInstrumentsAndReservation();
            given(promotionLedger.findByCode(USER_ID, MERCHANT_ID, "OLD")).willReturn(Optional.of(
                    new UserPromotion(8L, USER_ID, MERCHANT_ID, "OLD", new BigDecimal("10"),
                            PromotionStatus.ISSUED, NOW.minusDays(1), null, null, null, NOW.minusDays(30))));
            given(reservationReleasePort.release(RESERVATION_ID, USER_ID))
                    .willReturn(CompletableFuture.completedFuture(ReleaseOutcome.RELEASED));

            // when & then
            assertThatThrownBy(() -> settlementService.settle(reservationCommand("40", null, "OLD")))
                    .isInstanceOf(PromoExpiredException.class);
            verify(paymentRepository, never()).save(any());
            verify(reservationReleasePort).release(RESERVATION_ID, USER_ID);
        }

        @Test
        @DisplayName("PENDING이 아닌 예약이면 해제를 요청하지만 예외는 그대로 전달된다")
        void settle_NotPending() {
            given(paymentInstrumentPort.isCreditCardOwnedBy(CARD_ID, USER_ID)).willReturn(true);
            given(paymentInstrumentPort.isBillingAddressOwnedBy(ADDRESS_ID, USER_ID)).willReturn(true);
            given(reservationValidationPort.validateForPayment(RESERVATION_ID, USER_ID))
                    .willThrow(new ReservationNotPendingException(ReservationStatus.SCHEDULED));
            given(reservationReleasePort.release(RESERVATION_ID, USER_ID))
                    .willReturn(CompletableFuture.completedFuture(ReleaseOutcome.NOT_RELEASED));

            assertThatThrownBy(() -> settlementService.settle(reservationCommand("40", null, null)))
                    .isInstanceOf(ReservationNotPendingException.class);
            verify(reservationReleasePort).release(RESERVATION_ID, USER_ID);
        }
    }

    @Nested
    @DisplayName("원자 단위 실패")
    class AtomicFailures {

        @Test
        @DisplayName("리워드 경합에서 지면 RewardNoLongerAvailable이며 예약 해제를 요청한다")
        void settle_RewardRaceLost() {
            // given
            givenValidInstrumentsAndReservation();
            givenPaymentSaved();
            given(rewardLedger.findRedeemable(3L, USER_ID, MERCHANT_ID)).willReturn(Optional.of(
                    new AvailableReward(3L, USER_ID, MERCHANT_ID, new BigDecimal("20"), null, true, null, NOW)));
            given(rewardLedger.redeem(3L, USER_ID, MERCHANT_ID, NOW)).willReturn(false);
            given(reservationReleasePort.release(RESERVATION_ID, USER_ID))
                    .willReturn(CompletableFuture.completedFuture(ReleaseOutcome.RELEASED));

            // when & then
            assertThatThrownBy(() -> settlementService.settle(reservationCommand("100", 3L, null)))
                    .isInstanceOf(RewardNoLongerAvailableException.class);
            verify(reservationConfirmationPort, never()).confirmSettled(any());
            verify(reservationReleasePort).release(RESERVATION_ID, USER_ID);
            verify(requestNotificationUseCase, never()).request(any());
        }

        @Test
        @DisplayName("예약 상태가 동시에 바뀌면 ReservationConflict")
        void settle_ReservationConflict() {
            givenValidInstrumentsAndReservation();
            givenPaymentSaved();
            given(reservationConfirmationPort.confirmSettled(pendingReservation)).willReturn(false);
            given(reservationReleasePort.release(RESERVATION_ID, USER_ID))
                    .willReturn(CompletableFuture.completedFuture(ReleaseOutcome.NOT_RELEASED));

            assertThatThrownBy(() -> settlementService.settle(reservationCommand("100", null, null)))
                    .isInstanceOf(ReservationConflictException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode().getHttpStatus().value())
                    .isEqualTo(409);
        }

        @Test
        @DisplayName("예상하지 못한 오류는 SettlementFailed로 감싸진다")
        void settle_UnexpectedError() {
            givenValidInstrumentsAndReservation();
            given(paymentRepository.save(any())).willThrow(new IllegalStateException("db down"));
            given(reservationReleasePort.release(eq(RESERVATION_ID), eq(USER_ID)))
                    .willReturn(CompletableFuture.completedFuture(ReleaseOutcome.RELEASED));

            assertThatThrownBy(() -> settlementService.settle(reservationCommand("100", null, null)))
                    .isInstanceOf(SettlementFailedException.class)
                    .hasMessage("Failed to process payment");
            verify(reservationReleasePort).release(RESERVATION_ID, USER_ID);
        }
    }
}
