package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 槽位生成状态枚举
 */
public enum SlotStatusEnum {

    /** 待生成 */
    PENDING("pending"),

    /** 生成中 */
    GENERATING("generating"),

    /** 已完成 */
    COMPLETE("complete"),

    /** 生成失败 */
    ERROR("error");

    private final String code;

    SlotStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SlotStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SlotStatusEnum value : SlotStatusEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown slot status code: " + code);
    }
}
