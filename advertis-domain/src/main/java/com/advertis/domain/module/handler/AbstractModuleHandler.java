package com.advertis.domain.module.handler;

import com.advertis.domain.module.model.valobj.ModuleContext;
import com.advertis.domain.module.model.valobj.ModuleResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * 强类型模块基类：把解析后的输入转换为 I，计算出 O 后再转回 Map 交给执行器。
 *
 * @param <I> 输入类型，与描述符的 inputSchema 一致
 * @param <O> 输出类型，与描述符的 outputSchema 一致
 */
@Slf4j
public abstract class AbstractModuleHandler<I, O> implements IModuleHandler {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Class<I> inputType;

    protected AbstractModuleHandler(ObjectMapper objectMapper, Class<I> inputType) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.inputType = inputType;
    }

    @Override
    public final ModuleResult execute(ModuleContext context) {
        try {
            I input = objectMapper.convertValue(context.inputs(), inputType);
            O output = compute(input, context);
            return ModuleResult.ok(objectMapper.convertValue(output, MAP_TYPE));
        } catch (RuntimeException ex) {
            String message = StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
            log.warn("Module {} failed to compute. strategyId: {}, error: {}",
                    descriptor().id(), context.strategyId(), message);
            return ModuleResult.failure(message);
        }
    }

    protected abstract O compute(I input, ModuleContext context);
}
