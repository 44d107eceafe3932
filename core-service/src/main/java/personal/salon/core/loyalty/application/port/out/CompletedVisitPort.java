package personal.salon.core.loyalty.application.port.out;

import personal.salon.core.loyalty.domain.model.CompletedVisit;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Completed Visit Port
 * 적립 잡이 예약 저장소에 접근하는 책임
 */
public interface CompletedVisitPort {

    /**
     * 적립 대상 방문 조회 (COMPLETED, 미처리, 종료 시각 경과)
     */
    List<CompletedVisit> findUnprocessed(LocalDateTime now);

    /**
     * 적립 처리 완료 표시 (미처리 상태일 때만)
     *
     * @return false면 다른 작업자가 먼저 처리함
     */
    boolean markProcessed(Long reservationId);

    /**
     * 미처리 취소 예약 일괄 확인 처리
     */
    int markCanceledProcessed();
}
