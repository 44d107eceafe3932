package personal.salon.core.payment.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import personal.salon.core.payment.domain.model.SettlementResult;

import java.math.BigDecimal;

/**
 * 결제 정산 응답 DTO
 * originalAmount, discountType은 할인 적용 시에만, bookingStatusUpdated는 예약 결제 시에만 포함된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SettlementResponse(
        Long paymentId,
        BigDecimal amount,
        BigDecimal originalAmount,
        String discountType,
        Boolean bookingStatusUpdated) {

    public static SettlementResponse from(SettlementResult result) {
        return new SettlementResponse(
                result.paymentId(),
                result.amount(),
                result.originalAmount(),
                result.discountKind().label(),
                result.reservationConfirmed() ? Boolean.TRUE : null);
    }
}
