package personal.salon.core.payment.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.common.dto.ApiResponse;
import personal.salon.core.payment.adapter.in.web.dto.PromoPreviewRequest;
import personal.salon.core.payment.adapter.in.web.dto.PromoPreviewResponse;
import personal.salon.core.payment.adapter.in.web.dto.SettlePaymentRequest;
import personal.salon.core.payment.adapter.in.web.dto.SettlementResponse;
import personal.salon.core.payment.application.port.in.PreviewPromoCodeUseCase;
import personal.salon.core.payment.application.port.in.SettlePaymentUseCase;
import personal.salon.core.payment.domain.model.PromoPreview;
import personal.salon.core.payment.domain.model.SettlementResult;

/**
 * Payment API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final SettlePaymentUseCase settlePaymentUseCase;
    private final PreviewPromoCodeUseCase previewPromoCodeUseCase;

    /**
     * 결제 정산 (예약 또는 주문)
     * POST /api/v1/payments/settle
     */
    @PostMapping("/settle")
    public ResponseEntity<ApiResponse<SettlementResponse>> settle(
            @RequestHeader(value = "X-User-Id", required = false) Long userId,
            @RequestBody SettlePaymentRequest request
    ) {
        log.info("Settle payment: userId={}, reservationId={}, orderId={}",
                userId, request.reservationId(), request.orderId());

        SettlementResult result = settlePaymentUseCase.settle(request.toCommand(userId));

        return ResponseEntity.ok(ApiResponse.success("Payment processed successfully",
                SettlementResponse.from(result)));
    }

    /**
     * 프로모션 코드 적용 미리보기 (코드를 사용 처리하지 않음)
     * POST /api/v1/payments/promo-preview
     */
    @PostMapping("/promo-preview")
    public ResponseEntity<ApiResponse<PromoPreviewResponse>> previewPromoCode(
            @RequestHeader(value = "X-User-Id", required = false) Long userId,
            @RequestBody PromoPreviewRequest request
    ) {
        log.info("Preview promo code: userId={}, reservationId={}", userId, request.reservationId());

        PromoPreview preview = previewPromoCodeUseCase.preview(request.toCommand(userId));

        return ResponseEntity.ok(ApiResponse.success("Promo code is valid", PromoPreviewResponse.from(preview)));
    }
}
