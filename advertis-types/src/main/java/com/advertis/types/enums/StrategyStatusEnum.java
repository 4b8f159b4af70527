package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 策略整体状态枚举
 */
public enum StrategyStatusEnum {

    /** 草稿 */
    DRAFT("draft"),

    /** 生成中 */
    GENERATING("generating"),

    /** 已完成 */
    COMPLETE("complete");

    private final String code;

    StrategyStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static StrategyStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (StrategyStatusEnum value : StrategyStatusEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown strategy status code: " + code);
    }
}
