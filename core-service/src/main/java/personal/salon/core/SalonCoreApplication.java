package personal.salon.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Salon Core Application
 * Booking, Payment, Loyalty, Notification 도메인을 포함하는 핵심 비즈니스 서비스
 */
@SpringBootApplication(
    scanBasePackages = {
        "personal.salon.core",
        "personal.salon.common"  // common 모듈의 GlobalExceptionHandler, HealthCheckService 스캔
    }
)
public class SalonCoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(SalonCoreApplication.class, args);
    }
}
