package com.advertis.domain.content.model.valobj;

import java.util.List;

/**
 * 槽位内容解析结果。
 * <p>
 * data 始终是结构完整的文档；success=false 表示经过了修正或降级，errors 给出诊断信息。
 * </p>
 *
 * @param success 是否一次通过严格校验
 * @param data 可直接使用的文档
 * @param errors 诊断信息，成功时为空列表
 * @param <T> 文档类型
 */
public record ParseResult<T>(boolean success, T data, List<String> errors) {

    public ParseResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static <T> ParseResult<T> ok(T data) {
        return new ParseResult<>(true, data, List.of());
    }

    public static <T> ParseResult<T> degraded(T data, List<String> errors) {
        return new ParseResult<>(false, data, errors);
    }

    public static <T> ParseResult<T> degraded(T data, String error) {
        return new ParseResult<>(false, data, List.of(error));
    }

    /**
     * 以指定文档类型取出结果，类型不符时抛出 ClassCastException。
     */
    public <R> ParseResult<R> as(Class<R> documentType) {
        return new ParseResult<>(success, documentType.cast(data), errors);
    }
}
