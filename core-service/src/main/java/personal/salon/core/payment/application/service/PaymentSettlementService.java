package personal.salon.core.payment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.payment.application.port.in.SettlePaymentCommand;
import personal.salon.core.payment.application.port.in.SettlePaymentUseCase;
import personal.salon.core.payment.application.port.out.OrderLookupPort;
import personal.salon.core.payment.application.port.out.PaymentInstrumentPort;
import personal.salon.core.payment.application.port.out.ReservationReleasePort;
import personal.salon.core.payment.application.port.out.ReservationValidationPort;
import personal.salon.core.payment.domain.exception.BillingAddressNotFoundException;
import personal.salon.core.payment.domain.exception.CreditCardNotFoundException;
import personal.salon.core.payment.domain.exception.InvalidPaymentTargetException;
import personal.salon.core.payment.domain.exception.OrderNotFoundException;
import personal.salon.core.payment.domain.exception.SettlementFailedException;
import personal.salon.core.payment.domain.model.Payment;
import personal.salon.core.payment.domain.model.PaymentAmount;
import personal.salon.core.payment.domain.model.PurchaseOrder;
import personal.salon.core.payment.domain.model.ResolvedDiscount;
import personal.salon.core.payment.domain.model.SettlementPlan;
import personal.salon.core.payment.domain.model.SettlementResult;
import personal.salon.core.payment.domain.model.SettlementTarget;
import personal.salon.core.payment.domain.service.DiscountResolver;
import personal.salon.core.payment.domain.service.SettlementManager;

/**
 * Payment Settlement Service
 * 단일 책임: 정산 오케스트레이션
 *
 * 협력 객체:
 * - ReservationValidationPort / OrderLookupPort: 대상 검증
 * - DiscountResolver: 할인 검증 및 계산
 * - SettlementManager: 원자 단위 실행
 * - ReservationReleasePort: 실패 시 PENDING 예약 해제
 * - SettlementNotifier: 성공 후 알림 (실패해도 결과에 영향 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentSettlementService implements SettlePaymentUseCase {

    private final PaymentInstrumentPort paymentInstrumentPort;
    private final ReservationValidationPort reservationValidationPort;
    private final OrderLookupPort orderLookupPort;
    private final DiscountResolver discountResolver;
    private final SettlementManager settlementManager;
    private final ReservationReleasePort reservationReleasePort;
    private final SettlementNotifier settlementNotifier;

    @Override
    public SettlementResult settle(SettlePaymentCommand command) {
        try {
            SettlementPlan plan = prepare(command);
            Payment payment = settlementManager.settle(plan);
            settlementNotifier.notifySettled(payment, plan);
            return SettlementResult.from(payment);
        } catch (BusinessException e) {
            releaseReservation(command);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected settlement failure: userId={}, reservationId={}, orderId={}",
                    command.userId(), command.reservationId(), command.orderId(), e);
            releaseReservation(command);
            throw new SettlementFailedException("Failed to process payment", e);
        }
    }

    private SettlementPlan prepare(SettlePaymentCommand command) {
        // 1. 필수 값
        if (command.creditCardId() == null || command.billingAddressId() == null || command.amount() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Required fields: creditCardId, billingAddressId, amount");
        }

        // 2. 대상은 예약/주문 중 정확히 하나
        if ((command.reservationId() == null) == (command.orderId() == null)) {
            throw new InvalidPaymentTargetException();
        }

        // 3. 인증
        if (command.userId() == null) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Unauthorized");
        }

        // 4. 금액
        PaymentAmount originalAmount = PaymentAmount.of(command.amount());

        // 5. 결제 수단 소유권
        if (!paymentInstrumentPort.isCreditCardOwnedBy(command.creditCardId(), command.userId())) {
            throw new CreditCardNotFoundException();
        }
        if (!paymentInstrumentPort.isBillingAddressOwnedBy(command.billingAddressId(), command.userId())) {
            throw new BillingAddressNotFoundException();
        }

        // 6. 대상 검증
        SettlementTarget target = resolveTarget(command);

        // 7. 할인
        ResolvedDiscount discount = discountResolver.resolve(command.userId(), target, command.discountRequest());
        PaymentAmount chargedAmount = discount.isApplied()
                ? originalAmount.discountedBy(discount.percentage())
                : originalAmount;

        return new SettlementPlan(
                command.userId(),
                command.creditCardId(),
                command.billingAddressId(),
                target,
                originalAmount,
                chargedAmount,
                discount);
    }

    private SettlementTarget resolveTarget(SettlePaymentCommand command) {
        if (command.reservationId() != null) {
            return SettlementTarget.of(
                    reservationValidationPort.validateForPayment(command.reservationId(), command.userId()));
        }
        PurchaseOrder order = orderLookupPort.findById(command.orderId())
                .orElseThrow(() -> new OrderNotFoundException(command.orderId()));
        order.ensureOwnership(command.userId());
        return SettlementTarget.of(order);
    }

    /**
     * 실패한 정산의 예약 해제 요청 (PENDING + 본인 소유일 때만 삭제됨)
     */
    private void releaseReservation(SettlePaymentCommand command) {
        if (command.reservationId() == null || command.userId() == null) {
            return;
        }
        try {
            reservationReleasePort.release(command.reservationId(), command.userId());
        } catch (RuntimeException e) {
            log.error("Failed to request reservation release: reservationId={}", command.reservationId(), e);
        }
    }
}
