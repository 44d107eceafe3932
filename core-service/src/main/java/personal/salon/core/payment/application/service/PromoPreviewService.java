package personal.salon.core.payment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.booking.domain.model.Reservation;
import personal.salon.core.payment.application.port.in.PreviewPromoCodeCommand;
import personal.salon.core.payment.application.port.in.PreviewPromoCodeUseCase;
import personal.salon.core.payment.application.port.out.ReservationValidationPort;
import personal.salon.core.payment.domain.model.DiscountRequest;
import personal.salon.core.payment.domain.model.PaymentAmount;
import personal.salon.core.payment.domain.model.PromoPreview;
import personal.salon.core.payment.domain.model.ResolvedDiscount;
import personal.salon.core.payment.domain.model.SettlementTarget;
import personal.salon.core.payment.domain.service.DiscountResolver;

/**
 * Promo Preview Service
 * 정산과 같은 예약 검증과 DiscountResolver를 거쳐 할인 결과만 돌려준다. 원장은 변경하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PromoPreviewService implements PreviewPromoCodeUseCase {

    private final ReservationValidationPort reservationValidationPort;
    private final DiscountResolver discountResolver;

    @Override
    public PromoPreview preview(PreviewPromoCodeCommand command) {
        if (command.userId() == null) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Unauthorized");
        }
        if (command.reservationId() == null || command.promoCode() == null || command.promoCode().isBlank()
                || command.amount() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Required fields: promoCode, reservationId, amount");
        }

        PaymentAmount originalAmount = PaymentAmount.of(command.amount());
        Reservation reservation = reservationValidationPort.validateForPayment(
                command.reservationId(), command.userId());

        ResolvedDiscount discount = discountResolver.resolve(command.userId(), SettlementTarget.of(reservation),
                new DiscountRequest(null, command.promoCode()));
        PromoPreview preview = PromoPreview.of(discount, originalAmount,
                originalAmount.discountedBy(discount.percentage()));

        log.debug("Promo preview: userId={}, reservationId={}, promotionId={}, discountedAmount={}",
                command.userId(), command.reservationId(), preview.promotionId(), preview.discountedAmount());
        return preview;
    }
}
