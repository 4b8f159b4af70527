package com.advertis.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 策略 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属用户 ID
     */
    private String userId;

    /**
     * 品牌名称
     */
    private String name;

    /**
     * 描述
     */
    private String description;

    /**
     * 行业
     */
    private String sector;

    /**
     * 阶段编码
     */
    private String phase;

    /**
     * 状态编码
     */
    private String status;

    /**
     * 问卷答案 (JSONB)
     */
    private String answers;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
