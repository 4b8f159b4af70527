package com.advertis.trigger.application.command;

import com.advertis.api.dto.ModuleExecuteResponseDTO;
import com.advertis.domain.module.handler.IModuleHandler;
import com.advertis.domain.module.model.valobj.ModuleExecutionResult;
import com.advertis.domain.module.service.ModuleExecutor;
import com.advertis.domain.module.service.ModuleRegistry;
import com.advertis.types.enums.ModuleTriggerEnum;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块运行写用例：手动执行与槽位内容变更后的自动触发。
 */
@Slf4j
@Service
public class ModuleCommandService {

    private static final String METRIC_RUN_TOTAL = "advertis.module.run.total";

    private final ModuleExecutor moduleExecutor;
    private final ModuleRegistry moduleRegistry;

    public ModuleCommandService(ModuleExecutor moduleExecutor, ModuleRegistry moduleRegistry) {
        this.moduleExecutor = moduleExecutor;
        this.moduleRegistry = moduleRegistry;
    }

    public ModuleExecuteResponseDTO execute(String moduleId, Long strategyId, String userId) {
        if (StringUtils.isBlank(moduleId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "moduleId 不能为空");
        }
        if (strategyId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "strategyId 不能为空");
        }
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "userId 不能为空");
        }
        ModuleExecutionResult result = run(moduleId, strategyId, userId, ModuleTriggerEnum.MANUAL);

        ModuleExecuteResponseDTO dto = new ModuleExecuteResponseDTO();
        dto.setSuccess(result.success());
        dto.setRunId(result.runId());
        dto.setError(result.error());
        return dto;
    }

    /**
     * 执行所有以该槽位为输入且开启自动触发的模块。单个模块失败只记录日志，不影响其它模块与调用方。
     *
     * @return 已创建运行记录的 runId
     */
    public List<Long> dispatchAutoTriggers(Long strategyId, String userId, SlotTypeEnum slotType) {
        List<Long> runIds = new ArrayList<>();
        for (IModuleHandler handler : moduleRegistry.getAutoTriggeredBy(slotType)) {
            String moduleId = handler.descriptor().id();
            try {
                ModuleExecutionResult result = run(moduleId, strategyId, userId, ModuleTriggerEnum.AUTO);
                if (result.runId() != null) {
                    runIds.add(result.runId());
                }
                if (!result.success()) {
                    log.warn("Auto-triggered module failed. moduleId: {}, strategyId: {}, slot: {}, error: {}",
                            moduleId, strategyId, slotType.getCode(), result.error());
                }
            } catch (Exception ex) {
                log.error("Auto-trigger dispatch failed. moduleId: {}, strategyId: {}, slot: {}",
                        moduleId, strategyId, slotType.getCode(), ex);
            }
        }
        return runIds;
    }

    private ModuleExecutionResult run(String moduleId, Long strategyId, String userId, ModuleTriggerEnum trigger) {
        ModuleExecutionResult result = moduleExecutor.execute(moduleId, strategyId, userId, trigger);
        Counter.builder(METRIC_RUN_TOTAL)
                .tag("module", moduleRegistry.get(moduleId) == null ? "unknown" : moduleId)
                .tag("trigger", trigger.getCode())
                .tag("outcome", result.success() ? "success" : "failure")
                .register(Metrics.globalRegistry)
                .increment();
        return result;
    }
}
