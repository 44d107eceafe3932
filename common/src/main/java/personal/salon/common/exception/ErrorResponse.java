package personal.salon.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param code    ErrorCode의 코드 값 (예: "L005")
 * @param message 상세 메시지
 */
public record ErrorResponse(
        String code,
        String message
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message);
    }
}
