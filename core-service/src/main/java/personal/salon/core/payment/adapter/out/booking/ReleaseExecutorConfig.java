package personal.salon.core.payment.adapter.out.booking;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 예약 해제 전용 실행기
 */
@Configuration
public class ReleaseExecutorConfig {

    public static final String RELEASE_EXECUTOR = "reservationReleaseExecutor";

    @Bean(name = RELEASE_EXECUTOR)
    public Executor reservationReleaseExecutor(ReleaseProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getPoolSize());
        executor.setMaxPoolSize(properties.getPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("reservation-release-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
