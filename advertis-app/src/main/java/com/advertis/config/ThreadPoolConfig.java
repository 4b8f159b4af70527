package com.advertis.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置：模块输入解析的并发扇出使用 commonThreadPoolExecutor。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "commonThreadPoolExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "commonThreadPoolExecutor")
    public ThreadPoolExecutor commonThreadPoolExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(properties.getThreadNamePrefix() + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Init commonThreadPoolExecutor. core: {}, max: {}, queue: {}, policy: {}",
                coreSize, maxSize, properties.getBlockQueueSize(), properties.getPolicy());
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                rejectedExecutionHandler(properties.getPolicy()));
    }

    /**
     * 输入解析在请求线程上 join 等待，任务不能被静默丢弃：丢弃类策略回退为 CallerRunsPolicy。
     */
    private RejectedExecutionHandler rejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy) || "DiscardOldestPolicy".equals(policy)) {
            log.warn("Rejection policy '{}' would leave resolver futures incomplete, fallback to CallerRunsPolicy", policy);
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        if (!"CallerRunsPolicy".equals(policy)) {
            log.warn("Unknown rejection policy '{}', fallback to CallerRunsPolicy", policy);
        }
        return new ThreadPoolExecutor.CallerRunsPolicy();
    }

}
