package personal.salon.core.payment.application.port.out;

import personal.salon.core.payment.domain.model.ReleaseOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Reservation Release Port
 * 정산 실패 시 PENDING 예약을 삭제하는 보상 작업.
 * 호출자의 트랜잭션과 분리되어 실행되며 예외를 던지지 않는다.
 */
public interface ReservationReleasePort {

    CompletableFuture<ReleaseOutcome> release(Long reservationId, Long userId);
}
