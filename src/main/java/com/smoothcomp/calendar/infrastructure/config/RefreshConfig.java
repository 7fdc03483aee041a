package com.smoothcomp.calendar.infrastructure.config;

import com.smoothcomp.calendar.application.RefreshPolicy;
import com.smoothcomp.calendar.application.Throttle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableScheduling
public class RefreshConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RefreshPolicy refreshPolicy(SmoothcompProperties properties) {
        SmoothcompProperties.Refresh refresh = properties.getRefresh();
        return new RefreshPolicy(Duration.ofHours(refresh.getTtlHours()), refresh.getMaxEvents());
    }

    @Bean
    public Throttle refreshThrottle(SmoothcompProperties properties) {
        return Throttle.fixedDelay(properties.getRefresh().getRateLimit());
    }

    /**
     * Refresh cycles run here so request threads never block on scraping.
     * A single thread is enough: the guard never lets two cycles overlap.
     */
    @Bean(name = "refreshExecutor")
    public ThreadPoolTaskExecutor refreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("refresh-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
