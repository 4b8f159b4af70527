package com.advertis.domain.module.model.valobj;

/**
 * 一次模块执行的对外结果。runId 为 null 表示未创建运行记录（模块不存在或无权访问）。
 */
public record ModuleExecutionResult(boolean success, Long runId, String error) {

    public static ModuleExecutionResult success(Long runId) {
        return new ModuleExecutionResult(true, runId, null);
    }

    public static ModuleExecutionResult failure(Long runId, String error) {
        return new ModuleExecutionResult(false, runId, error);
    }
}
