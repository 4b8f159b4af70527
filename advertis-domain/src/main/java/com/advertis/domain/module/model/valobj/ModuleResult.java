package com.advertis.domain.module.model.valobj;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块计算结果。
 */
public record ModuleResult(boolean success, Map<String, Object> data, String error, Map<String, Object> metadata) {

    public ModuleResult {
        data = data == null ? new LinkedHashMap<>() : data;
        metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }

    public static ModuleResult ok(Map<String, Object> data) {
        return new ModuleResult(true, data, null, null);
    }

    public static ModuleResult failure(String error) {
        return new ModuleResult(false, null, error, null);
    }
}
