package com.rebalancer.config;

import com.rebalancer.concurrent.TimedCallExecutor;
import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${rebalancer.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${rebalancer.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${rebalancer.async.queue-capacity:100}")
    private int queueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Bounded pool that runs broker calls so a hung call can be abandoned after the
     * configured timeout.
     */
    @Bean("brokerCallPool")
    public ThreadPoolTaskExecutor brokerCallPool(RebalancerProperties rebalancerProperties) {
        int threads = rebalancerProperties.getBroker().getCallThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("broker-");
        return executor;
    }

    @Bean
    @Primary
    public TimedCallExecutor brokerCallExecutor(
            @Qualifier("brokerCallPool") ThreadPoolTaskExecutor brokerCallPool,
            RebalancerProperties rebalancerProperties) {
        return new TimedCallExecutor("Broker", brokerCallPool, rebalancerProperties.getBroker().getTimeout());
    }

    /** Leaderboard requests get their own thread so a hung API never starves broker calls. */
    @Bean("leaderboardCallPool")
    public ThreadPoolTaskExecutor leaderboardCallPool() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(5);
        executor.setThreadNamePrefix("leaderboard-");
        return executor;
    }

    @Bean
    public TimedCallExecutor leaderboardCallExecutor(
            @Qualifier("leaderboardCallPool") ThreadPoolTaskExecutor leaderboardCallPool,
            RebalancerProperties rebalancerProperties) {
        return new TimedCallExecutor(
                "Leaderboard", leaderboardCallPool, rebalancerProperties.getLeaderboard().getTimeout());
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
