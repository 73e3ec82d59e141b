package com.graphivault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pools behind the asynchronous command surface.
 *
 * <p>Store work and gateway calls run on separate bounded pools, so a slow
 * encryption gateway cannot starve catalog reads and writes.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfiguration {

    public static final String STORE_EXECUTOR = "storeExecutor";
    public static final String GATEWAY_EXECUTOR = "gatewayExecutor";

    @Bean(name = STORE_EXECUTOR)
    public Executor storeExecutor(VaultProperties properties) {
        int poolSize = properties.getExecutors().getStorePoolSize();
        log.info("Configuring store executor with {} threads", poolSize);
        return boundedExecutor("vault-store-", poolSize, properties.getExecutors().getQueueCapacity());
    }

    /**
     * Gateway calls block on a child process for as long as it runs.
     */
    @Bean(name = GATEWAY_EXECUTOR)
    public Executor gatewayExecutor(VaultProperties properties) {
        int poolSize = properties.getExecutors().getGatewayPoolSize();
        log.info("Configuring gateway executor with {} threads", poolSize);
        return boundedExecutor("vault-gateway-", poolSize, properties.getExecutors().getQueueCapacity());
    }

    private static ThreadPoolTaskExecutor boundedExecutor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
