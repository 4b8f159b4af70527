package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 槽位版本快照来源枚举
 */
public enum SlotVersionSourceEnum {

    /** 手动编辑 */
    MANUAL_EDIT("manual_edit"),

    /** 生成写入 */
    GENERATION("generation"),

    /** 版本恢复 */
    RESTORE("restore"),

    /** 审阅阶段修订 */
    REVIEW("review");

    private final String code;

    SlotVersionSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SlotVersionSourceEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SlotVersionSourceEnum value : SlotVersionSourceEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown slot version source code: " + code);
    }
}
