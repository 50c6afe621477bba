package org.policybot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 后台同步线程池。sync 运行本身用 syncTaskExecutor，
 * 运行内部按批并发处理文件用 syncWorkerExecutor，两者分开避免互相占满。
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("sync-job-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "syncWorkerExecutor")
    public ThreadPoolTaskExecutor syncWorkerExecutor(SyncProperties syncProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(syncProperties.getConcurrency());
        executor.setMaxPoolSize(syncProperties.getConcurrency());
        executor.setQueueCapacity(syncProperties.getConcurrency() * 4);
        executor.setThreadNamePrefix("sync-worker-");
        executor.initialize();
        return executor;
    }
}
