package com.advertis.domain.strategy.model.entity;

import com.advertis.types.enums.SlotStatusEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 内容槽位领域实体：每个策略每种槽位类型恰好一个。
 * <p>
 * content 为结构化 JSON 对象；历史记录可能是 TextNode；首次写入前为 null。
 * </p>
 */
@Data
public class SlotEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 策略 ID
     */
    private Long strategyId;

    /**
     * 槽位类型（创建后不可变）
     */
    private SlotTypeEnum type;

    /**
     * 状态
     */
    private SlotStatusEnum status;

    /**
     * 内容
     */
    private JsonNode content;

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

    public static SlotEntity empty(Long strategyId, SlotTypeEnum type) {
        SlotEntity entity = new SlotEntity();
        entity.setStrategyId(strategyId);
        entity.setType(type);
        entity.setStatus(SlotStatusEnum.PENDING);
        entity.setVersion(1);
        LocalDateTime now = LocalDateTime.now();
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 验证槽位是否有效
     */
    public void validate() {
        if (strategyId == null) {
            throw new IllegalStateException("Strategy ID cannot be null");
        }
        if (type == null) {
            throw new IllegalStateException("Slot type cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Slot status cannot be null");
        }
    }

    /**
     * 覆盖内容；status 为 null 时保持原状态。
     */
    public void writeContent(JsonNode newContent, SlotStatusEnum newStatus) {
        this.content = newContent;
        if (newStatus != null) {
            this.status = newStatus;
        }
        if (this.status == SlotStatusEnum.COMPLETE) {
            this.errorMessage = null;
        }
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 写入生成结果，diagnostics 非空时记录在 errorMessage 中。
     */
    public void markGenerated(JsonNode generated, String diagnostics) {
        this.content = generated;
        this.status = SlotStatusEnum.COMPLETE;
        this.errorMessage = diagnostics;
        this.generatedAt = LocalDateTime.now();
        this.updatedAt = this.generatedAt;
    }

    public boolean hasContent() {
        return content != null && !content.isNull() && !content.isMissingNode();
    }
}
