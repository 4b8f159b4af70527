package com.advertis.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 槽位 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 策略 ID (关联 strategy.id)
     */
    private Long strategyId;

    /**
     * 槽位类型编码
     */
    private String type;

    /**
     * 状态编码
     */
    private String status;

    /**
     * 内容 (JSONB，历史记录可能是 JSON 字符串)
     */
    private String content;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    /**
     * 错误/诊断信息
     */
    private String errorMessage;

    /**
     * 最近一次生成时间
     */
    private LocalDateTime generatedAt;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
