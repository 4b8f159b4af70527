package com.advertis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 模块输入解析线程池配置，前缀 thread.pool.executor.config。
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 8;

    /** 最大线程数 */
    private Integer maxPoolSize = 32;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveTime = 30L;

    /** 阻塞队列容量 */
    private Integer blockQueueSize = 1000;

    /** 线程名前缀 */
    private String threadNamePrefix = "advertis-resolver-";

    /**
     * 拒绝策略：AbortPolicy 或 CallerRunsPolicy，丢弃类策略会回退为 CallerRunsPolicy。
     * 默认 CallerRunsPolicy，池满时由请求线程自行解析输入。
     */
    private String policy = "CallerRunsPolicy";

}
