package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 模块输出写回槽位时的合并策略枚举
 */
public enum MergeStrategyEnum {

    /** 覆盖：新值无条件胜出 */
    REPLACE("replace"),

    /** 追加：数组拼接，字符串换行连接 */
    APPEND("append"),

    /** 合并：对象浅合并，新值优先 */
    MERGE("merge");

    private final String code;

    MergeStrategyEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static MergeStrategyEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MergeStrategyEnum value : MergeStrategyEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown merge strategy code: " + code);
    }
}
