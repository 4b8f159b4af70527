package com.advertis.trigger.application.query;

import com.advertis.api.dto.ModuleRunDTO;
import com.advertis.api.dto.ModuleSummaryDTO;
import com.advertis.domain.module.adapter.repository.IModuleRunRepository;
import com.advertis.domain.module.handler.IModuleHandler;
import com.advertis.domain.module.model.entity.ModuleRunEntity;
import com.advertis.domain.module.service.ModuleRegistry;
import com.advertis.trigger.application.common.StrategyAccessGuard;
import com.advertis.trigger.application.common.StrategyViewAssembler;
import com.advertis.types.enums.ModuleCategoryEnum;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 模块读用例：模块目录与运行历史。
 */
@Service
public class ModuleQueryService {

    private static final int DEFAULT_RUN_LIMIT = 20;

    private final ModuleRegistry moduleRegistry;
    private final IModuleRunRepository moduleRunRepository;
    private final StrategyAccessGuard strategyAccessGuard;
    private final StrategyViewAssembler strategyViewAssembler;

    @Value("${advertis.module.runs.max-limit:100}")
    private Integer maxRunLimit;

    public ModuleQueryService(ModuleRegistry moduleRegistry,
                              IModuleRunRepository moduleRunRepository,
                              StrategyAccessGuard strategyAccessGuard,
                              StrategyViewAssembler strategyViewAssembler) {
        this.moduleRegistry = moduleRegistry;
        this.moduleRunRepository = moduleRunRepository;
        this.strategyAccessGuard = strategyAccessGuard;
        this.strategyViewAssembler = strategyViewAssembler;
    }

    /**
     * 模块目录；slotType 与 category 同时给出时取交集。
     */
    public List<ModuleSummaryDTO> listModules(String slotType, String category) {
        List<IModuleHandler> handlers = StringUtils.isBlank(slotType)
                ? moduleRegistry.getAll()
                : moduleRegistry.getForSlot(StrategyAccessGuard.parseSlotType(slotType));
        ModuleCategoryEnum categoryFilter = parseCategory(category);
        return handlers.stream()
                .map(IModuleHandler::descriptor)
                .filter(descriptor -> categoryFilter == null || descriptor.category() == categoryFilter)
                .map(strategyViewAssembler::toModuleSummaryDTO)
                .collect(Collectors.toList());
    }

    public List<ModuleRunDTO> listRuns(Long strategyId, String userId, String moduleId, Integer limit) {
        strategyAccessGuard.requireOwned(strategyId, userId);
        int normalizedLimit = normalizeLimit(limit);
        return moduleRunRepository.findByStrategyId(strategyId, StringUtils.trimToNull(moduleId), normalizedLimit).stream()
                .map(strategyViewAssembler::toModuleRunDTO)
                .collect(Collectors.toList());
    }

    public ModuleRunDTO getRun(Long runId, String userId) {
        if (runId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "runId 不能为空");
        }
        ModuleRunEntity run = moduleRunRepository.findById(runId);
        if (run == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "运行记录不存在: " + runId);
        }
        strategyAccessGuard.requireOwned(run.getStrategyId(), userId);
        return strategyViewAssembler.toModuleRunDTO(run);
    }

    private int normalizeLimit(Integer limit) {
        int max = maxRunLimit == null || maxRunLimit <= 0 ? 100 : maxRunLimit;
        if (limit == null) {
            return Math.min(DEFAULT_RUN_LIMIT, max);
        }
        if (limit < 1 || limit > max) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "limit 取值范围为 1-" + max);
        }
        return limit;
    }

    private ModuleCategoryEnum parseCategory(String category) {
        if (StringUtils.isBlank(category)) {
            return null;
        }
        try {
            return ModuleCategoryEnum.fromCode(category.trim());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的模块类别: " + category, ex);
        }
    }
}
