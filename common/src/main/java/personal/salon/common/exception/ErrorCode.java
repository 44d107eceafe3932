package personal.salon.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Booking Domain (Bxxx)
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    RESERVATION_NOT_PENDING(HttpStatus.BAD_REQUEST, "B002", "결제 대기 상태의 예약이 아닙니다."),
    RESERVATION_ACCESS_DENIED(HttpStatus.FORBIDDEN, "B003", "해당 예약에 접근할 권한이 없습니다."),
    RESERVATION_CONFLICT(HttpStatus.CONFLICT, "B004", "결제 중 예약 상태가 변경되었습니다."),

    // Payment Domain (Pxxx)
    INVALID_PAYMENT_AMOUNT(HttpStatus.BAD_REQUEST, "P001", "결제 금액이 올바르지 않습니다."),
    DISCOUNTED_AMOUNT_TOO_LOW(HttpStatus.BAD_REQUEST, "P002", "할인 적용 후 결제 금액이 최소 금액보다 작습니다."),
    INVALID_PAYMENT_TARGET(HttpStatus.BAD_REQUEST, "P003", "예약 또는 주문 중 하나만 지정해야 합니다."),
    CREDIT_CARD_NOT_FOUND(HttpStatus.NOT_FOUND, "P004", "결제 수단을 찾을 수 없습니다."),
    BILLING_ADDRESS_NOT_FOUND(HttpStatus.NOT_FOUND, "P005", "청구지 주소를 찾을 수 없습니다."),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "P006", "주문을 찾을 수 없습니다."),
    ORDER_ACCESS_DENIED(HttpStatus.FORBIDDEN, "P007", "해당 주문에 접근할 권한이 없습니다."),
    SETTLEMENT_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "P008", "결제 처리에 실패했습니다."),

    // Loyalty Domain (Lxxx)
    BOTH_DISCOUNTS_REQUESTED(HttpStatus.BAD_REQUEST, "L001", "리워드와 프로모션 코드는 함께 사용할 수 없습니다."),
    REWARD_NOT_ELIGIBLE(HttpStatus.NOT_FOUND, "L002", "사용 가능한 리워드가 아닙니다."),
    PROMO_REQUIRES_RESERVATION(HttpStatus.BAD_REQUEST, "L003", "프로모션 코드는 예약 결제에만 사용할 수 있습니다."),
    PROMO_NOT_FOUND(HttpStatus.NOT_FOUND, "L004", "프로모션 코드를 찾을 수 없습니다."),
    PROMO_EXPIRED(HttpStatus.BAD_REQUEST, "L005", "만료된 프로모션 코드입니다."),
    REWARD_NO_LONGER_AVAILABLE(HttpStatus.CONFLICT, "L006", "리워드가 이미 사용되었습니다."),
    PROMO_NO_LONGER_AVAILABLE(HttpStatus.CONFLICT, "L007", "프로모션 코드가 이미 사용되었습니다."),
    PROMOTION_ALREADY_ISSUED(HttpStatus.CONFLICT, "L008", "이미 발급된 프로모션 코드입니다."),
    INVALID_DISCOUNT_PERCENTAGE(HttpStatus.BAD_REQUEST, "L009", "할인율이 올바르지 않습니다."),
    LOYALTY_PROGRAM_NOT_FOUND(HttpStatus.NOT_FOUND, "L010", "적립 프로그램을 찾을 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
