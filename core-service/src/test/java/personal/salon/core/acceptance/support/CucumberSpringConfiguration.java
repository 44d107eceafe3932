package personal.salon.core.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * H2(MySQL 모드) 위에서 실제 HTTP 요청으로 검증한다. 스케줄러는 비활성화하고 스텝에서 직접 실행한다.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({SalonTestAdapter.class})
public class CucumberSpringConfiguration {
}
