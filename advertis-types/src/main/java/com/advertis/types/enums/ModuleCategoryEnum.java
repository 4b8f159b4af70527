package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 模块类别枚举
 */
public enum ModuleCategoryEnum {

    /** 采集：从问卷或实体信息收集数据 */
    COLLECT("collect"),

    /** 推导：由已有槽位推导新内容 */
    DEDUCE("deduce"),

    /** 精修：改进已有槽位内容 */
    REFINE("refine"),

    /** 计算：评分与分析 */
    COMPUTE("compute");

    private final String code;

    ModuleCategoryEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ModuleCategoryEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ModuleCategoryEnum value : ModuleCategoryEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown module category code: " + code);
    }
}
