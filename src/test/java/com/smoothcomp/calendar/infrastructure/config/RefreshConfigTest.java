package com.smoothcomp.calendar.infrastructure.config;

import com.smoothcomp.calendar.application.RefreshPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RefreshConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(SmoothcompProperties.class, RefreshConfig.class);

    @Test
    void shouldInitializeSingleThreadRefreshExecutorOnce() {
        contextRunner.run(context -> {
            ThreadPoolTaskExecutor executor = context.getBean("refreshExecutor", ThreadPoolTaskExecutor.class);

            assertThat(executor.getThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getThreadPoolExecutor().getMaximumPoolSize()).isEqualTo(1);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("refresh-");

            CompletableFuture<String> threadName = new CompletableFuture<>();
            executor.execute(() -> threadName.complete(Thread.currentThread().getName()));
            assertThat(threadName.get(5, TimeUnit.SECONDS)).startsWith("refresh-");
            assertThat(executor.getThreadPoolExecutor().getPoolSize()).isEqualTo(1);
        });
    }

    @Test
    void shouldShutDownExecutorWithContext() {
        ThreadPoolTaskExecutor[] holder = new ThreadPoolTaskExecutor[1];
        contextRunner.run(context -> holder[0] = context.getBean("refreshExecutor", ThreadPoolTaskExecutor.class));

        assertThat(holder[0].getThreadPoolExecutor().isShutdown()).isTrue();
    }

    @Test
    void shouldBuildPolicyFromProperties() {
        contextRunner
                .withPropertyValues("smoothcomp.refresh.ttl-hours=3", "smoothcomp.refresh.max-events=10")
                .run(context -> {
                    RefreshPolicy policy = context.getBean(RefreshPolicy.class);
                    assertThat(policy.ttl()).isEqualTo(Duration.ofHours(3));
                    assertThat(policy.maxEvents()).isEqualTo(10);
                });
    }
}
