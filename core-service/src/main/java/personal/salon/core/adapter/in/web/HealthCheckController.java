package personal.salon.core.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.salon.common.dto.ApiResponse;
import personal.salon.common.dto.HealthCheckResponse;
import personal.salon.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 일부 구성 요소가 DOWN이어도 200을 반환하고 result 필드로 구분한다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        HealthCheckResponse data = healthCheckService.checkAll(dataSource);
        if (data.allUp()) {
            return ResponseEntity.ok(ApiResponse.success("Salon platform is healthy", data));
        }
        log.warn("Unhealthy components: {}", data);
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
