package com.advertis.domain.module.model.valobj;

import java.util.Collections;
import java.util.Map;

/**
 * 模块执行上下文。inputs 允许 null 值（来源缺失时）。
 */
public record ModuleContext(Long strategyId, String userId, Map<String, Object> inputs) {

    public ModuleContext {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(inputs);
    }
}
