package com.advertis.domain.module.model.entity;

import com.advertis.types.enums.ModuleRunStatusEnum;
import com.advertis.types.enums.ModuleTriggerEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 模块运行记录领域实体。
 * <p>
 * 状态只允许 running → complete 或 running → error，进入终态后不可再修改。
 * </p>
 */
@Data
public class ModuleRunEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 模块 ID
     */
    private String moduleId;

    /**
     * 策略 ID
     */
    private Long strategyId;

    /**
     * 触发用户
     */
    private String userId;

    /**
     * 运行状态
     */
    private ModuleRunStatusEnum status;

    /**
     * 触发方式
     */
    private ModuleTriggerEnum triggeredBy;

    /**
     * 输入快照
     */
    private Map<String, Object> inputSnapshot;

    /**
     * 输出数据
     */
    private Map<String, Object> outputData;

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

    public static ModuleRunEntity start(String moduleId, Long strategyId, String userId, ModuleTriggerEnum trigger) {
        ModuleRunEntity entity = new ModuleRunEntity();
        entity.setModuleId(moduleId);
        entity.setStrategyId(strategyId);
        entity.setUserId(userId);
        entity.setStatus(ModuleRunStatusEnum.RUNNING);
        entity.setTriggeredBy(trigger == null ? ModuleTriggerEnum.MANUAL : trigger);
        LocalDateTime now = LocalDateTime.now();
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 验证运行记录是否有效
     */
    public void validate() {
        if (moduleId == null || moduleId.trim().isEmpty()) {
            throw new IllegalStateException("Module ID cannot be empty");
        }
        if (strategyId == null) {
            throw new IllegalStateException("Strategy ID cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Run status cannot be null");
        }
    }

    /**
     * 标记为成功
     */
    public void complete(Map<String, Object> inputSnapshot, Map<String, Object> outputData, long durationMs) {
        requireOpen("complete");
        this.status = ModuleRunStatusEnum.COMPLETE;
        this.inputSnapshot = inputSnapshot;
        this.outputData = outputData;
        this.durationMs = durationMs;
        this.errorMessage = null;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 标记为失败
     */
    public void fail(String errorMessage, long durationMs) {
        requireOpen("fail");
        this.status = ModuleRunStatusEnum.ERROR;
        this.errorMessage = errorMessage;
        this.durationMs = durationMs;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    private void requireOpen(String action) {
        if (isTerminal()) {
            throw new IllegalStateException("Cannot " + action + " module run " + id + " in status: " + status.getCode());
        }
    }
}
