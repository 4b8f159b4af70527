package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 模块运行状态枚举
 */
public enum ModuleRunStatusEnum {

    /** 已创建 */
    PENDING("pending"),

    /** 运行中 */
    RUNNING("running"),

    /** 运行成功 */
    COMPLETE("complete"),

    /** 运行失败 */
    ERROR("error");

    private final String code;

    ModuleRunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    public static ModuleRunStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ModuleRunStatusEnum value : ModuleRunStatusEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown module run status code: " + code);
    }
}
