package personal.salon.core.payment.adapter.out.booking;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 예약 해제 실행기 설정
 *
 * 설정 예시:
 * payment:
 *   release:
 *     pool-size: 2
 *     queue-capacity: 500
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "payment.release")
public class ReleaseProperties {

    private int poolSize = 2;

    /**
     * 가득 차면 해제 요청은 거절되고 FAILED로 기록된다.
     */
    private int queueCapacity = 500;
}
