package com.deepansh.trendagent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Thread pools for loop executions and tool calls.
 *
 * Loop runs never execute on servlet threads. Tool calls get their own pool so
 * the dispatcher can bound and abandon them.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentTaskExecutor")
    public ThreadPoolTaskExecutor agentTaskExecutor(AgentProperties properties) {
        AgentProperties.Executor sizing = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sizing.getCorePoolSize());
        executor.setMaxPoolSize(sizing.getMaxPoolSize());
        executor.setQueueCapacity(sizing.getQueueCapacity());
        executor.setThreadNamePrefix("agent-loop-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "toolTaskExecutor")
    public ThreadPoolTaskExecutor toolTaskExecutor(AgentProperties properties) {
        int size = properties.getExecutor().getToolPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("agent-tool-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
