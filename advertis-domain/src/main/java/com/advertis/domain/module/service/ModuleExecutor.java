package com.advertis.domain.module.service;

import com.advertis.domain.module.adapter.repository.IModuleRunRepository;
import com.advertis.domain.module.handler.IModuleHandler;
import com.advertis.domain.module.model.entity.ModuleRunEntity;
import com.advertis.domain.module.model.valobj.ModuleContext;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleExecutionResult;
import com.advertis.domain.module.model.valobj.ModuleResult;
import com.advertis.domain.strategy.adapter.repository.IStrategyRepository;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.types.enums.ModuleTriggerEnum;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 模块执行器：负责单次模块运行的完整生命周期。
 * <p>
 * 创建运行记录 → 解析输入 → 校验输入 → 执行模块 → 校验输出 → 写回槽位 → 记录成功。
 * 运行记录创建之后的任何异常都会把记录置为 error 并以失败结果返回，不向调用方抛出。
 * 模块不存在或策略不属于调用方时不创建运行记录。
 * </p>
 */
@Slf4j
@Service
public class ModuleExecutor {

    public static final String ERROR_STRATEGY_NOT_FOUND = "Strategy not found or unauthorized";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ModuleRegistry moduleRegistry;
    private final IStrategyRepository strategyRepository;
    private final IModuleRunRepository moduleRunRepository;
    private final ModuleInputResolver inputResolver;
    private final ModuleSchemaValidator schemaValidator;
    private final ModuleOutputApplier outputApplier;
    private final ObjectMapper objectMapper;

    public ModuleExecutor(ModuleRegistry moduleRegistry,
                          IStrategyRepository strategyRepository,
                          IModuleRunRepository moduleRunRepository,
                          ModuleInputResolver inputResolver,
                          ModuleSchemaValidator schemaValidator,
                          ModuleOutputApplier outputApplier,
                          ObjectMapper objectMapper) {
        this.moduleRegistry = moduleRegistry;
        this.strategyRepository = strategyRepository;
        this.moduleRunRepository = moduleRunRepository;
        this.inputResolver = inputResolver;
        this.schemaValidator = schemaValidator;
        this.outputApplier = outputApplier;
        this.objectMapper = objectMapper;
    }

    public ModuleExecutionResult execute(String moduleId, Long strategyId, String userId, ModuleTriggerEnum triggeredBy) {
        IModuleHandler handler = moduleRegistry.get(moduleId);
        if (handler == null) {
            return ModuleExecutionResult.failure(null, "Module not found: " + moduleId);
        }
        StrategyEntity strategy = strategyId == null ? null : strategyRepository.findById(strategyId);
        if (strategy == null || !strategy.isOwnedBy(userId)) {
            return ModuleExecutionResult.failure(null, ERROR_STRATEGY_NOT_FOUND);
        }

        ModuleDescriptor descriptor = handler.descriptor();
        ModuleRunEntity run = ModuleRunEntity.start(moduleId, strategyId, userId, triggeredBy);
        run.validate();
        run = moduleRunRepository.save(run);
        long startNanos = System.nanoTime();

        try {
            Map<String, Object> inputs = inputResolver.resolve(descriptor, strategy);

            List<String> inputErrors = schemaValidator.validate(inputs, descriptor.inputSchema());
            if (!inputErrors.isEmpty()) {
                throw new IllegalStateException("Input validation failed: " + String.join(", ", inputErrors));
            }

            ModuleResult result = handler.execute(new ModuleContext(strategyId, userId, inputs));
            if (!result.success()) {
                throw new IllegalStateException(StringUtils.defaultIfBlank(result.error(), "Module execution failed"));
            }

            List<String> outputErrors = schemaValidator.validate(result.data(), descriptor.outputSchema());
            if (!outputErrors.isEmpty()) {
                throw new IllegalStateException("Output validation failed: " + String.join(", ", outputErrors));
            }

            int slotsWritten = outputApplier.apply(descriptor, strategyId, result.data());

            run.complete(snapshot(inputs), snapshot(result.data()), elapsedMillis(startNanos));
            if (!moduleRunRepository.update(run)) {
                log.warn("Module run already finalized, completion not persisted. runId: {}", run.getId());
            }
            log.info("Module run complete. moduleId: {}, strategyId: {}, runId: {}, slotsWritten: {}, durationMs: {}",
                    moduleId, strategyId, run.getId(), slotsWritten, run.getDurationMs());
            return ModuleExecutionResult.success(run.getId());
        } catch (Exception ex) {
            String message = StringUtils.defaultIfBlank(ex.getMessage(), "Unknown error");
            log.warn("Module run failed. moduleId: {}, strategyId: {}, runId: {}, error: {}",
                    moduleId, strategyId, run.getId(), message);
            recordFailure(run, message, elapsedMillis(startNanos));
            return ModuleExecutionResult.failure(run.getId(), message);
        }
    }

    private void recordFailure(ModuleRunEntity run, String message, long durationMs) {
        if (run.isTerminal()) {
            return;
        }
        try {
            run.fail(message, durationMs);
            moduleRunRepository.update(run);
        } catch (Exception persistEx) {
            log.error("Failed to persist module run failure. runId: {}", run.getId(), persistEx);
        }
    }

    private Map<String, Object> snapshot(Map<String, Object> value) {
        return value == null ? null : objectMapper.convertValue(value, MAP_TYPE);
    }

    private long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
