package com.advertis.test;

import com.advertis.config.ThreadPoolConfig;
import com.advertis.config.ThreadPoolConfigProperties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ThreadPoolExecutor;

public class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig();

    @Test
    public void shouldFallbackToCallerRunsWhenDiscardPolicyConfigured() {
        for (String policy : new String[]{"DiscardPolicy", "DiscardOldestPolicy"}) {
            ThreadPoolExecutor executor = config.commonThreadPoolExecutor(properties(policy));
            try {
                Assertions.assertInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class,
                        executor.getRejectedExecutionHandler(), policy);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Test
    public void shouldKeepAbortPolicyAndDefaultUnknownToCallerRuns() {
        ThreadPoolExecutor abort = config.commonThreadPoolExecutor(properties("AbortPolicy"));
        ThreadPoolExecutor unknown = config.commonThreadPoolExecutor(properties("QueueForeverPolicy"));
        try {
            Assertions.assertInstanceOf(ThreadPoolExecutor.AbortPolicy.class, abort.getRejectedExecutionHandler());
            Assertions.assertInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class, unknown.getRejectedExecutionHandler());
        } finally {
            abort.shutdownNow();
            unknown.shutdownNow();
        }
    }

    private ThreadPoolConfigProperties properties(String policy) {
        ThreadPoolConfigProperties properties = new ThreadPoolConfigProperties();
        properties.setCorePoolSize(1);
        properties.setMaxPoolSize(1);
        properties.setBlockQueueSize(1);
        properties.setPolicy(policy);
        return properties;
    }
}
