package personal.salon.core.payment.application.port.in;

import personal.salon.core.payment.domain.model.PromoPreview;

public interface PreviewPromoCodeUseCase {

    /**
     * 결제와 같은 검증으로 코드를 확인하고 할인 금액을 계산한다.
     * 코드를 사용 처리하지 않는다.
     */
    PromoPreview preview(PreviewPromoCodeCommand command);
}
