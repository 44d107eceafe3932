package personal.salon.core.payment.adapter.out.booking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import personal.salon.core.booking.application.port.out.ReservationRepository;
import personal.salon.core.payment.application.port.out.ReservationReleasePort;
import personal.salon.core.payment.domain.model.ReleaseOutcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Reservation Release Adapter
 * 실패한 정산의 PENDING 예약을 별도 스레드, 별도 트랜잭션에서 삭제한다.
 * 결과는 로그로만 남기며 호출자에게 예외를 전파하지 않는다.
 */
@Slf4j
@Component
public class ReservationReleaseAdapter implements ReservationReleasePort {

    private final ReservationRepository reservationRepository;
    private final Executor releaseExecutor;
    private final TransactionTemplate requiresNewTransaction;

    public ReservationReleaseAdapter(ReservationRepository reservationRepository,
                                     @Qualifier(ReleaseExecutorConfig.RELEASE_EXECUTOR) Executor releaseExecutor,
                                     PlatformTransactionManager transactionManager) {
        this.reservationRepository = reservationRepository;
        this.releaseExecutor = releaseExecutor;
        this.requiresNewTransaction = new TransactionTemplate(transactionManager);
        this.requiresNewTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public CompletableFuture<ReleaseOutcome> release(Long reservationId, Long userId) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> releaseInNewTransaction(reservationId, userId), releaseExecutor)
                    .exceptionally(e -> {
                        log.error("Reservation release failed: reservationId={}, userId={}",
                                reservationId, userId, e);
                        return ReleaseOutcome.FAILED;
                    });
        } catch (RejectedExecutionException e) {
            log.error("Reservation release rejected by executor: reservationId={}, userId={}",
                    reservationId, userId, e);
            return CompletableFuture.completedFuture(ReleaseOutcome.FAILED);
        }
    }

    private ReleaseOutcome releaseInNewTransaction(Long reservationId, Long userId) {
        Boolean deleted = requiresNewTransaction.execute(
                status -> reservationRepository.deletePendingOwnedBy(reservationId, userId));

        if (Boolean.TRUE.equals(deleted)) {
            log.info("Pending reservation released after failed settlement: reservationId={}, userId={}",
                    reservationId, userId);
            return ReleaseOutcome.RELEASED;
        }
        log.debug("Reservation not released (not pending or not owned): reservationId={}", reservationId);
        return ReleaseOutcome.NOT_RELEASED;
    }
}
