package com.valuerank.orchestration.config;

import java.time.Clock;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class ExecutorConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = {"orchestrationExecutor", "taskExecutor"})
    ThreadPoolTaskExecutor orchestrationExecutor(OrchestratorProperties properties) {
        int poolSize = Math.max(1, properties.getExecutorPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("orchestration-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    static class MdcTaskDecorator implements TaskDecorator {

        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> parentMdc = MDC.getCopyOfContextMap();
            return () -> {
                if (parentMdc != null) {
                    MDC.setContextMap(parentMdc);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
