package com.advertis.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 模块运行记录 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleRunPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 模块 ID
     */
    private String moduleId;

    /**
     * 策略 ID (关联 strategy.id)
     */
    private Long strategyId;

    /**
     * 触发用户
     */
    private String userId;

    /**
     * 状态编码
     */
    private String status;

    /**
     * 触发方式编码
     */
    private String triggeredBy;

    /**
     * 输入快照 (JSONB)
     */
    private String inputSnapshot;

    /**
     * 输出数据 (JSONB)
     */
    private String outputData;

    /**
     * 错误信息
     */
    private String errorMessage;

    /**
     * 执行耗时 (毫秒)
     */
    private Long durationMs;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
